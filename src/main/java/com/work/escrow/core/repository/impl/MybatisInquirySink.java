package com.work.escrow.core.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.escrow.core.inquiry.InquirySink;
import com.work.escrow.core.model.OnChainMilestone;
import com.work.escrow.core.model.ReclaimInquiry;
import com.work.escrow.core.repository.entity.ReclaimInquiryEntity;
import com.work.escrow.core.repository.mapper.ReclaimInquiryMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把人工退款请求落库，供运营侧处理。milestone 快照以 JSON 存储。
 */
public class MybatisInquirySink implements InquirySink {

    private final ReclaimInquiryMapper mapper;
    private final ObjectMapper objectMapper;

    public MybatisInquirySink(ReclaimInquiryMapper mapper, ObjectMapper objectMapper) {
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    @Override
    public void submit(ReclaimInquiry inquiry) {
        ReclaimInquiryEntity e = new ReclaimInquiryEntity();
        e.setId(inquiry.getId());
        e.setJobId(inquiry.getJobId());
        e.setRequesterWallet(inquiry.getRequesterWallet());
        e.setRequesterContact(inquiry.getRequesterContact());
        e.setNote(inquiry.getNote());
        e.setTotalStaked(inquiry.getTotalStaked());
        e.setMilestoneSnapshot(snapshotJson(inquiry.getMilestoneSnapshots()));
        e.setCreatedAt(inquiry.getCreatedAt());
        mapper.insert(e);
    }

    String snapshotJson(List<OnChainMilestone> milestones) {
        List<Map<String, Object>> rows = new ArrayList<>(milestones.size());
        for (OnChainMilestone m : milestones) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("index", m.getStageIndex());
            row.put("amount", m.getAmount());
            row.put("approved", m.isApproved());
            row.put("claimed", m.isClaimed());
            rows.add(row);
        }
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize milestone snapshot", ex);
        }
    }
}

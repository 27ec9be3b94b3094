package com.work.escrow.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.escrow.core.repository.entity.ReclaimInquiryEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 人工退款请求表 Mapper（插入走 BaseMapper#insert）
 */
public interface ReclaimInquiryMapper extends BaseMapper<ReclaimInquiryEntity> {

    @Select("SELECT id, job_id, requester_wallet, requester_contact, note, total_staked, milestone_snapshot, created_at " +
            "FROM reclaim_inquiry WHERE job_id = #{jobId} ORDER BY created_at ASC")
    List<ReclaimInquiryEntity> listByJob(@Param("jobId") String jobId);
}

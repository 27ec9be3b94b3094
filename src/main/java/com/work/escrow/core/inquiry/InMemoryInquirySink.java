package com.work.escrow.core.inquiry;

import com.work.escrow.core.model.ReclaimInquiry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 进程内 InquirySink，仅用于本地运行与测试。
 */
public class InMemoryInquirySink implements InquirySink {

    private final List<ReclaimInquiry> inquiries = new CopyOnWriteArrayList<>();

    @Override
    public void submit(ReclaimInquiry inquiry) {
        inquiries.add(inquiry);
    }

    public List<ReclaimInquiry> list() {
        return Collections.unmodifiableList(new ArrayList<>(inquiries));
    }
}

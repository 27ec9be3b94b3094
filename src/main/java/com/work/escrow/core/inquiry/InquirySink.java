package com.work.escrow.core.inquiry;

import com.work.escrow.core.model.ReclaimInquiry;

/**
 * 人工退款请求的投递端口（邮件、工单或数据库由宿主决定）。投递失败时抛出运行时异常。
 */
public interface InquirySink {

    void submit(ReclaimInquiry inquiry);
}

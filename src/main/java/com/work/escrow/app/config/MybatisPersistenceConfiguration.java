package com.work.escrow.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.escrow.core.inquiry.InquirySink;
import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.repository.impl.MybatisInquirySink;
import com.work.escrow.core.repository.impl.MybatisLedgerStore;
import com.work.escrow.core.repository.mapper.JobMapper;
import com.work.escrow.core.repository.mapper.MilestoneMapper;
import com.work.escrow.core.repository.mapper.ReclaimInquiryMapper;
import com.work.escrow.core.repository.mapper.TransactionRecordMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * PostgreSQL 镜像存储：escrow.ledger-mode=postgres 时启用。表结构见 db/schema.sql。
 */
@Configuration
@ConditionalOnProperty(prefix = "escrow", name = "ledger-mode", havingValue = "postgres")
@MapperScan("com.work.escrow.core.repository.mapper")
public class MybatisPersistenceConfiguration {

    @Bean
    public LedgerStore mybatisLedgerStore(JobMapper jobMapper,
                                          MilestoneMapper milestoneMapper,
                                          TransactionRecordMapper transactionMapper,
                                          ObjectMapper objectMapper) {
        return new MybatisLedgerStore(jobMapper, milestoneMapper, transactionMapper, objectMapper);
    }

    @Bean
    public InquirySink mybatisInquirySink(ReclaimInquiryMapper mapper, ObjectMapper objectMapper) {
        return new MybatisInquirySink(mapper, objectMapper);
    }
}

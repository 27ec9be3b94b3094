package com.work.escrow.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.escrow.core.repository.entity.TransactionRecordEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 交易流水表 Mapper（没有 update 语句：记录只追加）
 */
public interface TransactionRecordMapper extends BaseMapper<TransactionRecordEntity> {

    /**
     * signature 唯一；重复时不插入，返回 0
     */
    @Insert("INSERT INTO escrow_transaction(id, job_id, milestone_id, from_wallet, to_wallet, amount, type, signature, status, synthetic, created_at) " +
            "VALUES(#{e.id}, #{e.jobId}, #{e.milestoneId}, #{e.fromWallet}, #{e.toWallet}, #{e.amount}, #{e.type}, #{e.signature}, " +
            "#{e.status}, #{e.synthetic}, #{e.createdAt}) " +
            "ON CONFLICT(signature) DO NOTHING")
    int insertIfAbsent(@Param("e") TransactionRecordEntity entity);

    @Select("SELECT id, job_id, milestone_id, from_wallet, to_wallet, amount, type, signature, status, synthetic, created_at " +
            "FROM escrow_transaction WHERE signature = #{signature}")
    TransactionRecordEntity findBySignature(@Param("signature") String signature);

    @Select("SELECT id, job_id, milestone_id, from_wallet, to_wallet, amount, type, signature, status, synthetic, created_at " +
            "FROM escrow_transaction WHERE milestone_id = #{milestoneId} AND type = #{type} " +
            "ORDER BY created_at ASC LIMIT 1")
    TransactionRecordEntity findByMilestoneAndType(@Param("milestoneId") String milestoneId, @Param("type") String type);

    @Select("SELECT id, job_id, milestone_id, from_wallet, to_wallet, amount, type, signature, status, synthetic, created_at " +
            "FROM escrow_transaction WHERE job_id = #{jobId} AND type = #{type} " +
            "ORDER BY created_at ASC LIMIT 1")
    TransactionRecordEntity findJobLevel(@Param("jobId") String jobId, @Param("type") String type);

    @Select("SELECT id, job_id, milestone_id, from_wallet, to_wallet, amount, type, signature, status, synthetic, created_at " +
            "FROM escrow_transaction WHERE job_id = #{jobId} ORDER BY created_at ASC")
    List<TransactionRecordEntity> listByJob(@Param("jobId") String jobId);
}

package com.work.escrow.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.escrow.core.repository.entity.JobEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * job 镜像表 Mapper
 */
public interface JobMapper extends BaseMapper<JobEntity> {

    @Select("SELECT id, total_payment, status, recruiter_wallet, freelancer_wallet, escrow_address, created_at, updated_at " +
            "FROM escrow_job WHERE id = #{id}")
    JobEntity findJob(@Param("id") String id);

    /**
     * 按 id 插入或整行覆盖（后写为准）
     */
    @Insert("INSERT INTO escrow_job(id, total_payment, status, recruiter_wallet, freelancer_wallet, escrow_address, created_at, updated_at) " +
            "VALUES(#{e.id}, #{e.totalPayment}, #{e.status}, #{e.recruiterWallet}, #{e.freelancerWallet}, #{e.escrowAddress}, #{e.createdAt}, #{e.updatedAt}) " +
            "ON CONFLICT(id) DO UPDATE SET total_payment = #{e.totalPayment}, status = #{e.status}, " +
            "recruiter_wallet = #{e.recruiterWallet}, freelancer_wallet = #{e.freelancerWallet}, " +
            "escrow_address = #{e.escrowAddress}, updated_at = #{e.updatedAt}")
    int upsertJob(@Param("e") JobEntity entity);

    /**
     * 仅插入；id 已存在时不写入，返回 0
     */
    @Insert("INSERT INTO escrow_job(id, total_payment, status, recruiter_wallet, freelancer_wallet, escrow_address, created_at, updated_at) " +
            "VALUES(#{e.id}, #{e.totalPayment}, #{e.status}, #{e.recruiterWallet}, #{e.freelancerWallet}, #{e.escrowAddress}, #{e.createdAt}, #{e.updatedAt}) " +
            "ON CONFLICT(id) DO NOTHING")
    int insertIfAbsent(@Param("e") JobEntity entity);
}

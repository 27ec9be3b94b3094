package com.work.escrow.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.escrow.core.repository.entity.MilestoneEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

/**
 * milestone 镜像表 Mapper
 */
public interface MilestoneMapper extends BaseMapper<MilestoneEntity> {

    @Select("SELECT id, job_id, stage_number, amount, status, payment_released, submission_description, " +
            "submission_links, submission_files, reviewer_comments, submitted_at, reviewed_at, updated_at " +
            "FROM escrow_milestone WHERE job_id = #{jobId} ORDER BY stage_number ASC")
    List<MilestoneEntity> listByJob(@Param("jobId") String jobId);

    @Select("SELECT id, job_id, stage_number, amount, status, payment_released, submission_description, " +
            "submission_links, submission_files, reviewer_comments, submitted_at, reviewed_at, updated_at " +
            "FROM escrow_milestone WHERE job_id = #{jobId} AND stage_number = #{stageNumber}")
    MilestoneEntity findByStage(@Param("jobId") String jobId, @Param("stageNumber") int stageNumber);

    /**
     * (job_id, stage_number) 唯一；冲突时整行覆盖
     */
    @Insert("INSERT INTO escrow_milestone(id, job_id, stage_number, amount, status, payment_released, submission_description, " +
            "submission_links, submission_files, reviewer_comments, submitted_at, reviewed_at, updated_at) " +
            "VALUES(#{e.id}, #{e.jobId}, #{e.stageNumber}, #{e.amount}, #{e.status}, #{e.paymentReleased}, #{e.submissionDescription}, " +
            "#{e.submissionLinks}, #{e.submissionFiles}, #{e.reviewerComments}, #{e.submittedAt}, #{e.reviewedAt}, #{e.updatedAt}) " +
            "ON CONFLICT(job_id, stage_number) DO UPDATE SET amount = #{e.amount}, status = #{e.status}, " +
            "payment_released = #{e.paymentReleased}, submission_description = #{e.submissionDescription}, " +
            "submission_links = #{e.submissionLinks}, submission_files = #{e.submissionFiles}, " +
            "reviewer_comments = #{e.reviewerComments}, submitted_at = #{e.submittedAt}, " +
            "reviewed_at = #{e.reviewedAt}, updated_at = #{e.updatedAt}")
    int upsertMilestone(@Param("e") MilestoneEntity entity);

    /**
     * 只更新链上派生列
     */
    @Update("UPDATE escrow_milestone SET status = #{status}, payment_released = #{paymentReleased}, " +
            "amount = #{amount}, updated_at = #{updatedAt} WHERE job_id = #{jobId} AND stage_number = #{stageNumber}")
    int updateChainState(@Param("jobId") String jobId,
                         @Param("stageNumber") int stageNumber,
                         @Param("status") String status,
                         @Param("paymentReleased") boolean paymentReleased,
                         @Param("amount") long amount,
                         @Param("updatedAt") Instant updatedAt);
}

package com.work.escrow.core.support;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    /**
     * jobId 合法字符集与长度限制（合约侧 job_id 最长 50 字符）。
     */
    private static final Pattern JOB_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9:_-]{1,50}$");

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验 jobId 的格式与长度。
     * <p>约束：长度 1~50，仅允许 [a-zA-Z0-9:_-]。</p>
     */
    public static String requireValidJobId(String jobId) {
        requireNonEmpty(jobId, "jobId");
        if (!JOB_ID_PATTERN.matcher(jobId).matches()) {
            throw new IllegalArgumentException("jobId 非法，只允许 1~50 位的字母、数字、':'、'_'、'-'");
        }
        return jobId;
    }
}

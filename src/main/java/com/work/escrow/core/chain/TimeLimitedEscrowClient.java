package com.work.escrow.core.chain;

import com.work.escrow.core.exception.EscrowException;
import com.work.escrow.core.exception.TransientFailureException;
import com.work.escrow.core.model.EscrowAccountView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import static com.work.escrow.core.support.ValidationUtils.requireNonNull;
import static com.work.escrow.core.support.ValidationUtils.requirePositive;

/**
 * 给每一次链上调用加超时边界的装饰器。
 *
 * 读与写的失败语义不同：
 * - 读失败/超时：{@link TransientFailureException}，重试读是安全的
 * - 写超时或非确定性失败：{@link ChainTimeoutException}，结果未知，调用方必须重新读取链上状态
 * - 写被明确拒绝：原样抛出 {@link ChainSubmissionException}
 */
public class TimeLimitedEscrowClient implements EscrowClient {

    private static final Logger log = LoggerFactory.getLogger(TimeLimitedEscrowClient.class);

    private final EscrowClient delegate;
    private final Executor executor;
    private final Duration readTimeout;
    private final Duration submitTimeout;

    public TimeLimitedEscrowClient(EscrowClient delegate, Executor executor, Duration readTimeout, Duration submitTimeout) {
        this.delegate = requireNonNull(delegate, "delegate");
        this.executor = requireNonNull(executor, "executor");
        this.readTimeout = requirePositive(readTimeout, "readTimeout");
        this.submitTimeout = requirePositive(submitTimeout, "submitTimeout");
    }

    @Override
    public Optional<EscrowAccountView> readAccount(String jobId) {
        try {
            return await(() -> delegate.readAccount(jobId), readTimeout);
        } catch (TimeoutException e) {
            throw new TransientFailureException("chain read timed out after " + readTimeout.toMillis() + "ms, job=" + jobId, e);
        } catch (EscrowException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransientFailureException("chain read failed, job=" + jobId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String submitApprove(String jobId, int stageIndex, WalletSigner signer) {
        return submit("approve", jobId, () -> delegate.submitApprove(jobId, stageIndex, signer));
    }

    @Override
    public String submitClaim(String jobId, int stageIndex, WalletSigner signer) {
        return submit("claim", jobId, () -> delegate.submitClaim(jobId, stageIndex, signer));
    }

    @Override
    public String submitCancel(String jobId, WalletSigner signer) {
        return submit("cancel", jobId, () -> delegate.submitCancel(jobId, signer));
    }

    private String submit(String op, String jobId, Supplier<String> call) {
        try {
            return await(call, submitTimeout);
        } catch (TimeoutException e) {
            log.warn("chain submit timed out op={} job={} timeoutMs={}", op, jobId, submitTimeout.toMillis());
            throw new ChainTimeoutException(op, op + " submission timed out, outcome unknown, job=" + jobId, e);
        } catch (ChainSubmissionException | ChainTimeoutException e) {
            throw e;
        } catch (RuntimeException e) {
            // 非确定性失败：交易可能已被节点接收，按“结果未知”处理
            ChainErrorKind kind = ChainErrorClassifier.classify(e);
            if (kind != ChainErrorKind.UNKNOWN) {
                throw new ChainSubmissionException(kind, e.getMessage(), e);
            }
            log.warn("chain submit failed without definitive signal op={} job={} err={}", op, jobId, e.toString());
            throw new ChainTimeoutException(op, op + " submission failed without definitive result, job=" + jobId, e);
        }
    }

    private <T> T await(Supplier<T> call, Duration timeout) throws TimeoutException {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new TransientFailureException("interrupted while waiting for chain", ie);
        } catch (TimeoutException te) {
            future.cancel(true);
            throw te;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TransientFailureException("chain call failed: " + cause, cause);
        }
    }
}

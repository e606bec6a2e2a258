package com.gymtracker.service;

import com.gymtracker.exception.UpstreamFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * 训练数据的事务边界。开启、提交、回滚事务时的失败（连接不可用、提交超时等）
 * 统一转换为 UpstreamFailureException；已加入外层事务的调用不会重复开启事务。
 */
@Slf4j
@Component
public class TransactionRunner {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public TransactionRunner(PlatformTransactionManager transactionManager) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
    }

    public <T> T call(String operation, Supplier<T> action) {
        return execute(writeTemplate, operation, action);
    }

    public void run(String operation, Runnable action) {
        execute(writeTemplate, operation, () -> {
            action.run();
            return null;
        });
    }

    public <T> T read(String operation, Supplier<T> action) {
        return execute(readTemplate, operation, action);
    }

    private <T> T execute(TransactionTemplate template, String operation, Supplier<T> action) {
        try {
            return template.execute(status -> action.get());
        } catch (TransactionException e) {
            log.error("事务失败 - operation: {}", operation, e);
            throw new UpstreamFailureException(operation, e);
        }
    }
}

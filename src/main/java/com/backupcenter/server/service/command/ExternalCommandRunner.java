package com.backupcenter.server.service.command;

import com.backupcenter.server.exception.ValidationException;
import com.backupcenter.server.model.dump.CommandExecResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.ExecuteResultHandler;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.Executor;
import org.apache.commons.exec.PumpStreamHandler;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs pg_dump, pg_restore, psql and mount. Extra environment entries (e.g. PGPASSWORD) are handed to the
 * child process only; they never appear in the argument vector or in log output.
 */
@Slf4j
@Component
public class ExternalCommandRunner {

    public CommandExecResult execute(
            CommandLine commandLine,
            Map<String, String> extraEnvMap,
            Duration timeout) throws ValidationException {
        CompletableFuture<CommandExecResult> future = this.executeAsync(commandLine, extraEnvMap, timeout);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CommandExecResult.failed(e);
        } catch (ExecutionException e) {
            return CommandExecResult.failed(e.getCause());
        }
    }

    public CompletableFuture<CommandExecResult> executeAsync(
            CommandLine commandLine,
            Map<String, String> extraEnvMap,
            Duration timeout) throws ValidationException {
        // 检查参数
        if (ObjectUtils.anyNull(commandLine, timeout)) {
            throw new ValidationException("execute failed. commandLine or timeout is null");
        }
        Executor executor = DefaultExecutor.builder().get();
        CompletableFuture<CommandExecResult> future = new CompletableFuture<>();
        // 1. 捕获 stdout/stderr
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        executor.setStreamHandler(new PumpStreamHandler(stdout, stderr));
        // 2. 设置超时
        ExecuteWatchdog watchdog = ExecuteWatchdog.builder().setTimeout(timeout).get();
        executor.setWatchdog(watchdog);
        // 3. 非阻塞执行
        log.info("executing {}", commandLine.getExecutable());
        log.debug("arguments {}", String.join(" ", commandLine.getArguments()));
        try {
            executor.execute(commandLine, getEnv(extraEnvMap), new ExecuteResultHandler() {
                @Override
                public void onProcessComplete(int exitCode) {
                    future.complete(CommandExecResult.success(
                            exitCode, getStdAsString(stdout), getStdAsString(stderr)));
                }

                @Override
                public void onProcessFailed(ExecuteException e) {
                    String stderrString = getStdAsString(stderr);
                    if (watchdog.killedProcess()) {
                        stderrString = "killed after %s. %s".formatted(timeout, stderrString);
                    }
                    future.complete(CommandExecResult.failed(
                            e.getExitValue(), getStdAsString(stdout), stderrString));
                }
            });
        } catch (Exception e) {
            future.complete(CommandExecResult.failed(e));
        }
        return future;
    }

    private static String getStdAsString(ByteArrayOutputStream std) {
        if (ObjectUtils.isEmpty(std)) {
            return "";
        }
        return std.toString(StandardCharsets.UTF_8).trim();
    }

    private static Map<String, String> getEnv(Map<String, String> extraEnvMap) {
        // 继承当前进程的环境变量
        Map<String, String> result = new HashMap<>(System.getenv());
        if (MapUtils.isNotEmpty(extraEnvMap)) {
            result.putAll(extraEnvMap);
        }
        return result;
    }
}

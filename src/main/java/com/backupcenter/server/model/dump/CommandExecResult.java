package com.backupcenter.server.model.dump;

import com.backupcenter.server.exception.BusinessException;
import com.backupcenter.server.exception.ExternalToolException;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

@Data
public class CommandExecResult {

    private boolean success;

    private Integer exitCode;

    private String stdout;

    private String stderr;

    // fall back caught exception, the process did not run to an exit code
    private BusinessException ex;

    private CommandExecResult() {}

    // 成功响应工厂
    public static CommandExecResult success(int exitCode, String stdout, String stderr) {
        CommandExecResult result = new CommandExecResult();
        result.setSuccess(true);
        result.setExitCode(exitCode);
        result.setStdout(stdout);
        result.setStderr(stderr);
        return result;
    }

    // 失败响应工厂
    public static CommandExecResult failed(int exitCode, String stdout, String stderr) {
        CommandExecResult result = new CommandExecResult();
        result.setSuccess(false);
        result.setExitCode(exitCode);
        result.setStdout(stdout);
        result.setStderr(stderr);
        return result;
    }

    // Exception 响应工厂
    public static CommandExecResult failed(Throwable ex) {
        CommandExecResult result = new CommandExecResult();
        result.setSuccess(false);
        result.setEx(new BusinessException("command failed with unexpected exception.", ex));
        return result;
    }

    public ExternalToolException getExternalToolException(String toolName) {
        if (this.success) return null;
        if (this.exitCode != null) {
            return new ExternalToolException(this.exitCode, "%s exited with code %s. stderr is %s".formatted(
                    toolName, this.exitCode, StringUtils.abbreviate(this.stderr, 2000)));
        }
        return new ExternalToolException("%s failed before exit.".formatted(toolName), this.ex);
    }
}

package com.backupcenter.server.model.agent;

import com.backupcenter.server.exception.TransportException;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

@Data
public class AgentHttpResponse<T> {

    private int httpCode;

    private boolean success;

    private T data;

    // has response but http code is not 2xx
    private String errorBody;

    // does not have response
    private TransportException ex;

    private AgentHttpResponse() {}

    // 成功响应工厂
    public static <T> AgentHttpResponse<T> success(int httpCode, T data) {
        AgentHttpResponse<T> response = new AgentHttpResponse<>();
        response.setHttpCode(httpCode);
        response.setSuccess(true);
        response.setData(data);
        return response;
    }

    // 错误响应工厂
    public static <T> AgentHttpResponse<T> error(int httpCode, String errorBody) {
        AgentHttpResponse<T> response = new AgentHttpResponse<>();
        response.setHttpCode(httpCode);
        response.setSuccess(false);
        response.setErrorBody(errorBody);
        return response;
    }

    // 无响应工厂
    public static <T> AgentHttpResponse<T> error(Throwable ex) {
        AgentHttpResponse<T> response = new AgentHttpResponse<>();
        response.setSuccess(false);
        response.setEx(new TransportException("agent request failed with unexpected exception", ex));
        return response;
    }

    public TransportException getTransportException() {
        if (this.success) return null;
        if (this.ex == null) {
            return new TransportException("agent response has error http code %s. body is %s".formatted(
                    this.httpCode, StringUtils.abbreviate(this.errorBody, 500)));
        }
        return this.ex;
    }
}

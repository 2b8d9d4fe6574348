package exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 业务异常基类
 * <p>
 * 网关内所有可预期的失败（查询规划、远端拉取、响应解析、配置校验）均以该类的子类抛出，
 * 调用方可统一按错误码区分处理。
 *
 * @author hli
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class BusinessException extends RuntimeException {
    /**
     * 错误码
     */
    private Integer errorCode;

    /**
     * 消息内容
     */
    private String message;

    public BusinessException(Integer errorCode, String message) {
        super(message);
        this.message = message;
        this.errorCode = errorCode;
    }

    /**
     * 支持异常链的构造函数
     *
     * @param errorCode 错误码
     * @param message   消息内容
     * @param cause     原始异常
     */
    public BusinessException(Integer errorCode, String message, Throwable cause) {
        super(message, cause);
        this.message = message;
        this.errorCode = errorCode;
    }
}

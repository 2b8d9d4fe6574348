package exception;

/**
 * 配置异常类
 *
 * 设计目的：
 * 1. 封装网关配置错误，如兜底时间窗口起止颠倒、开放窗口天数非正数。
 * 2. 在应用启动绑定配置或首次使用配置时快速失败。
 *
 * @author hli
 */
public class ConfigurationException extends BusinessException {

    private static final Integer DEFAULT_ERROR_CODE = 4002;

    public ConfigurationException(String message) {
        super(DEFAULT_ERROR_CODE, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(DEFAULT_ERROR_CODE, message, cause);
    }
}

package exception;

/**
 * 外部服务异常类
 *
 * 设计目的：
 * 1. 封装调用 NTP 远端接口失败（网络错误、鉴权失败、非预期状态码）。
 * 2. 扫描驱动不做重试，直接向上抛出，由宿主决定中止扫描或降级。
 *
 * @author hli
 */
public class ExternalServiceException extends BusinessException {

    private static final Integer DEFAULT_ERROR_CODE = 5001;

    public ExternalServiceException(String message) {
        super(DEFAULT_ERROR_CODE, message);
    }

    public ExternalServiceException(Integer errorCode, String message) {
        super(errorCode, message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(DEFAULT_ERROR_CODE, message, cause);
    }

    public ExternalServiceException(Integer errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}

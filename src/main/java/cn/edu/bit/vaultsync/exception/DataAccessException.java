package cn.edu.bit.vaultsync.exception;

/**
 * 数据库访问异常，包装 SQLException
 */
public class DataAccessException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public DataAccessException(String message) {
        super(message);
    }

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}

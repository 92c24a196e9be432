package cn.edu.bit.vaultsync.exception;

/**
 * 秒传链接格式错误
 */
public class MalformedHashLinkException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String link;

    public MalformedHashLinkException(String link, String reason) {
        super("Malformed hash link (" + reason + "): " + link);
        this.link = link;
    }

    public MalformedHashLinkException(String link, String reason, Throwable cause) {
        super("Malformed hash link (" + reason + "): " + link, cause);
        this.link = link;
    }

    public String getLink() {
        return link;
    }
}

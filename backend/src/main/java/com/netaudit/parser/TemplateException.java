package com.netaudit.parser;

/**
 * 模板加载失败。任何一条规则不合法都会导致整个模板加载失败，不存在部分加载。
 */
public class TemplateException extends RuntimeException {

    private final Reason reason;
    private final String group;
    private final String ruleRef;

    public TemplateException(Reason reason, String group, String ruleRef, String message) {
        super(message);
        this.reason = reason;
        this.group = group;
        this.ruleRef = ruleRef;
    }

    public TemplateException(Reason reason, String group, String ruleRef, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.group = group;
        this.ruleRef = ruleRef;
    }

    public static TemplateException malformed(String message, Throwable cause) {
        return new TemplateException(Reason.MALFORMED_DOCUMENT, null, null, message, cause);
    }

    public Reason getReason() {
        return reason;
    }

    /** 出错的分组键名，文档级错误时为 null */
    public String getGroup() {
        return group;
    }

    /** 出错规则的名称或序号（如 "#3"），文档级错误时为 null */
    public String getRuleRef() {
        return ruleRef;
    }

    public enum Reason {
        MISSING_FIELD,
        INVALID_SEVERITY,
        INVALID_PATTERN,
        DUPLICATE_NAME,
        MALFORMED_DOCUMENT
    }
}

package com.emcit.application.audit;

public final class AuditActions {

    public static final String LICENSE_CREATE = "LICENSE_CREATE";
    public static final String LICENSE_REVEAL = "LICENSE_REVEAL";
    public static final String LICENSE_REVEAL_DENIED = "LICENSE_REVEAL_DENIED";
    public static final String USER_CREATE = "USER_CREATE";
    public static final String USER_UPDATE = "USER_UPDATE";
    public static final String USER_DELETE = "USER_DELETE";
    public static final String CREATE_TICKET = "CREATE_TICKET";
    public static final String UPDATE_TICKET = "UPDATE_TICKET";
    public static final String ASSET_CREATE = "ASSET_CREATE";
    public static final String LOGIN = "LOGIN";

    private AuditActions() {}

    public static String target(String type, Object id) {
        return type + ":" + id;
    }
}

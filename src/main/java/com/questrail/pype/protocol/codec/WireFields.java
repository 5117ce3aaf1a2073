package com.questrail.pype.protocol.codec;

/**
 * JSON field names and tag values of the pype wire format.
 */
final class WireFields
{
    private WireFields() {
    }

    static final String TYPE = "type";
    static final String SUBTYPE = "subtype";
    static final String MODE = "mode";

    static final String NAME = "name";
    static final String STATUS = "status";
    static final String USER_INFO_LST = "user_info_lst";
    static final String CALL_INFO_LST = "call_info_lst";
    static final String CALLER = "caller";
    static final String CALLEE = "callee";
    static final String MASTER = "master";
    static final String MASTER_HOST = "master_host";
    static final String USER = "user";
    static final String INFO = "info";
    static final String PARTICIPANTS = "participants";
    static final String ADDRESSES = "addresses";
    static final String MEDIUM = "medium";
    static final String PAYLOAD = "payload";
    static final String SOURCE = "source";
    static final String PUBLIC_KEY = "public_key";
    static final String KEY = "key";
    static final String IV = "iv";
    static final String RATE = "rate";
    static final String ENABLED = "enabled";
    static final String TEXT = "text";
    static final String ACCEPT = "accept";

    static final String TYPE_JOIN = "join";
    static final String TYPE_USER_UPDATE = "user_update";
    static final String TYPE_CALL = "call";
    static final String TYPE_CALL_UPDATE = "call_update";
    static final String TYPE_SESSION = "session";
    static final String TYPE_LOCAL = "local";

    static final String STATUS_ACCEPT = "accept";
    static final String STATUS_REJECT = "reject";
}

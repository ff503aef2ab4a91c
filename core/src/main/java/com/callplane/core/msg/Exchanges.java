package com.callplane.core.msg;

/**
 * Bus naming shared by publishers and consumers.
 */
public final class Exchanges {
    private Exchanges() {
    }

    /**
     * Queue consumed by the dispatcher, bound to the call-control exchange.
     */
    public static final String DISPATCHER_QUEUE = "applicationd";

    /**
     * Every exchange the dispatcher declares is a topic exchange.
     */
    public static final String EXCHANGE_TYPE = "topic";

    public static final String CONTENT_TYPE_JSON = "application/json";

    /**
     * Inbound document fields.
     */
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_ASTERISK_ID = "asterisk_id";
    public static final String FIELD_APPLICATION = "application";

    /**
     * Fallback location of the application name: {@code channel.dialplan.app_data}.
     */
    public static final String[] APPLICATION_FALLBACK_PATH = {"channel", "dialplan", "app_data"};
}

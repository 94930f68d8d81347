package com.federation.infrastructure.context;

import org.slf4j.MDC;

public final class RequestContext {

    private static final String ACTOR_KEY = "actorKey";
    private static final String REQUEST_ID_KEY = "requestId";

    private static final ThreadLocal<String> currentActorKey = new ThreadLocal<>();
    private static final ThreadLocal<String> currentRequestId = new ThreadLocal<>();

    private RequestContext() {}

    public static void set(String actorKey, String requestId) {
        currentActorKey.set(actorKey);
        currentRequestId.set(requestId);
        if (actorKey != null) {
            MDC.put(ACTOR_KEY, actorKey);
        }
        MDC.put(REQUEST_ID_KEY, requestId);
    }

    /**
     * Acting identity of the current request, null on reads and outside requests.
     */
    public static String getActorKey() {
        return currentActorKey.get();
    }

    public static String getRequestId() {
        return currentRequestId.get();
    }

    public static void clear() {
        currentActorKey.remove();
        currentRequestId.remove();
        MDC.remove(ACTOR_KEY);
        MDC.remove(REQUEST_ID_KEY);
    }
}

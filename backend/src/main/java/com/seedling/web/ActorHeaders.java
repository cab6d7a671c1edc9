package com.seedling.web;

/**
 * Request headers identifying the acting user. Authentication happens upstream of this service.
 */
public final class ActorHeaders {

    public static final String USER_ID = "X-User-Id";

    private ActorHeaders() {
    }
}

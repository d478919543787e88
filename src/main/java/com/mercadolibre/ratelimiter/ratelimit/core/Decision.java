package com.mercadolibre.ratelimiter.ratelimit.core;

public record Decision(boolean allowed, Outcome outcome, String endpoint) {

    public enum Outcome { UNLIMITED, ADMITTED, REJECTED, FAIL_OPEN }

    public static Decision unlimited(String endpoint) { return new Decision(true, Outcome.UNLIMITED, endpoint); }
    public static Decision admitted(String endpoint) { return new Decision(true, Outcome.ADMITTED, endpoint); }
    public static Decision failOpen(String endpoint) { return new Decision(true, Outcome.FAIL_OPEN, endpoint); }
    public static Decision rejected(String endpoint) { return new Decision(false, Outcome.REJECTED, endpoint); }
}

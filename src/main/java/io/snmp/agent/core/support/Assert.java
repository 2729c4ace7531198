package io.snmp.agent.core.support;

public class Assert {

    public static void isTrue(boolean exp, String error, Object... args) {
        if (!exp) {
            throw new IllegalArgumentException(String.format(error, args));
        }
    }

    public static void nonNull(Object o, String error, Object... args) {
        isTrue(o != null, error, args);
    }

}

package com.fieldops.dismantle.logging;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Aspect
@Configuration
public class ServiceLoggingAspect {

    private static final int MAX_STRING = 120;

    /** Every public method of a {@code @Service} bean. */
    @Around("within(@org.springframework.stereotype.Service *)")
    public Object logAround(ProceedingJoinPoint pjp) throws Throwable {

        String method = pjp.getSignature().getDeclaringType().getSimpleName() + "." + pjp.getSignature().getName();
        long start = System.currentTimeMillis();
        log.debug("ENTER {}({})", method, argList(pjp.getArgs()));

        try {
            Object result = pjp.proceed();
            log.debug("EXIT  {} → {} ({} ms)", method, shorten(result), System.currentTimeMillis() - start);
            return result;

        } catch (Throwable ex) {
            log.warn("FAIL  {} – {}", method, ex.toString());
            throw ex;
        }
    }

    private String argList(Object[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        return Arrays.stream(args)
                .map(this::shorten)
                .collect(Collectors.joining(", "));
    }

    /** Compact rendering so chat bodies and collections do not flood the log. */
    String shorten(Object o) {

        if (o == null) return "null";

        if (o instanceof Number || o instanceof Boolean || o instanceof Enum<?>)
            return o.toString();

        if (o instanceof String s) {
            return s.length() <= MAX_STRING
                    ? "\"" + s + "\""
                    : "\"" + s.substring(0, MAX_STRING - 3) + "…\"(length=" + s.length() + ")";
        }

        if (o.getClass().isArray()) {
            return o.getClass().getComponentType().getSimpleName() +
                    "[" + Array.getLength(o) + "]";
        }

        if (o instanceof Collection<?> c) {
            return c.getClass().getSimpleName() + "(size=" + c.size() + ")";
        }

        if (o instanceof Map<?, ?> m) {
            return m.getClass().getSimpleName() + "(size=" + m.size() + ")";
        }

        // entities: «ChatRoom[id=…]»
        try {
            Method idGetter = o.getClass().getMethod("getId");
            return o.getClass().getSimpleName() + "[id=" + idGetter.invoke(o) + "]";
        } catch (NoSuchMethodException noId) {
            return o.getClass().getSimpleName();
        } catch (ReflectiveOperationException | RuntimeException ex) {
            log.trace("getId() failed on {}", o.getClass().getSimpleName(), ex);
            return o.getClass().getSimpleName();
        }
    }
}

/*
 * Copyright 2024 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.keyrelay;

import java.security.Key;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.AbstractLogger;

/**
 * An slf4j-compatible logger that redacts certain types of arguments to prevent them being leaked in log files.
 * Byte arrays are reduced to their first and last three bytes (or dropped entirely when short) and keys are never
 * printed at all.
 */
public final class RedactedLogger extends AbstractLogger {
    private static final String FQCN = RedactedLogger.class.getName();

    private final transient Logger realLogger;

    private RedactedLogger(Logger realLogger) {
        this.realLogger = Objects.requireNonNull(realLogger);
        this.name = realLogger.getName();
    }

    public static Logger getLogger(Class<?> forClass) {
        return new RedactedLogger(LoggerFactory.getLogger(forClass));
    }

    @Override
    protected String getFullyQualifiedCallerName() {
        return FQCN;
    }

    @Override
    protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern, Object[] arguments,
            Throwable throwable) {
        var builder = realLogger.makeLoggingEventBuilder(level).setMessage(messagePattern);
        if (marker != null) {
            builder = builder.addMarker(marker);
        }
        if (arguments != null) {
            for (var arg : arguments) {
                builder = builder.addArgument(redact(arg));
            }
        }
        if (throwable != null) {
            builder = builder.setCause(throwable);
        }
        builder.log();
    }

    @Override
    public boolean isTraceEnabled() {
        return realLogger.isTraceEnabled();
    }

    @Override
    public boolean isTraceEnabled(Marker marker) {
        return realLogger.isTraceEnabled(marker);
    }

    @Override
    public boolean isDebugEnabled() {
        return realLogger.isDebugEnabled();
    }

    @Override
    public boolean isDebugEnabled(Marker marker) {
        return realLogger.isDebugEnabled(marker);
    }

    @Override
    public boolean isInfoEnabled() {
        return realLogger.isInfoEnabled();
    }

    @Override
    public boolean isInfoEnabled(Marker marker) {
        return realLogger.isInfoEnabled(marker);
    }

    @Override
    public boolean isWarnEnabled() {
        return realLogger.isWarnEnabled();
    }

    @Override
    public boolean isWarnEnabled(Marker marker) {
        return realLogger.isWarnEnabled(marker);
    }

    @Override
    public boolean isErrorEnabled() {
        return realLogger.isErrorEnabled();
    }

    @Override
    public boolean isErrorEnabled(Marker marker) {
        return realLogger.isErrorEnabled(marker);
    }

    static Object redact(Object arg) {
        if (arg instanceof byte[] bytes) {
            return maskForLog(bytes);
        } else if (arg instanceof Key key) {
            return "<redacted " + key.getAlgorithm() + " key>";
        } else {
            return arg;
        }
    }

    private static String maskForLog(byte[] secret) {
        if (secret.length < 16) {
            return "<redacted>";
        }
        var hex = HexFormat.of();
        return hex.formatHex(Arrays.copyOf(secret, 3)) + "..." +
                hex.formatHex(Arrays.copyOfRange(secret, secret.length - 3, secret.length));
    }
}

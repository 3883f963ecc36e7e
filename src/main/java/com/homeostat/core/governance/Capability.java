package com.homeostat.core.governance;

import com.homeostat.core.model.ToolCall;

import java.io.Serializable;
import java.util.Locale;
import java.util.Map;

/**
 * A permission unit checked by the {@link GovernanceGate}.
 *
 * @param kind      what sort of capability this is
 * @param name      tool name or model role; {@code "slot"} for concurrency
 * @param arguments tool arguments, inspected for path and command restrictions
 */
public record Capability(
        Kind kind,
        String name,
        Map<String, Object> arguments
) implements Serializable {

    public enum Kind {
        TOOL,
        MODEL_ROLE,
        CONCURRENCY
    }

    public Capability {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static Capability tool(ToolCall call) {
        return new Capability(Kind.TOOL, call.name(), call.arguments());
    }

    public static Capability tool(String name, Map<String, Object> arguments) {
        return new Capability(Kind.TOOL, name, arguments);
    }

    public static Capability modelRole(String role) {
        return new Capability(Kind.MODEL_ROLE, role, Map.of());
    }

    public static Capability concurrencySlot() {
        return new Capability(Kind.CONCURRENCY, "slot", Map.of());
    }

    public String describe() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + name;
    }
}

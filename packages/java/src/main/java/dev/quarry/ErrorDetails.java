package dev.quarry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured, serializable description of a failure.
 *
 * <p>This is the shape every error takes when it crosses a call boundary: a stable
 * {@link ErrorCode}, the message, and optional context such as the plugin or dependency
 * involved and, for captured runtime faults, the source location and stack trace.</p>
 *
 * <p>Instances are plain values. Callers that hand them across a native boundary own the
 * serialized copy; within the JVM the captured-fault slot is released with
 * {@link ErrorUtils#releaseLastFault()}.</p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ErrorDetails {
    private final ErrorCode kind;
    private final String message;
    private final String pluginName;
    private final String dependency;
    private final Map<String, Object> context;
    private final String source;
    private final String trace;
    private final boolean fault;

    private ErrorDetails(Builder builder) {
        this.kind = builder.kind != null ? builder.kind : ErrorCode.INTERNAL;
        this.message = builder.message != null ? builder.message : "";
        this.pluginName = builder.pluginName;
        this.dependency = builder.dependency;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
        this.source = builder.source;
        this.trace = builder.trace;
        this.fault = builder.fault;
    }

    @JsonCreator
    static ErrorDetails fromWire(
        @JsonProperty("code") Integer code,
        @JsonProperty("name") String name,
        @JsonProperty("message") String message,
        @JsonProperty("plugin_name") String pluginName,
        @JsonProperty("dependency") String dependency,
        @JsonProperty("context") Map<String, Object> context,
        @JsonProperty("source") String source,
        @JsonProperty("trace") String trace,
        @JsonProperty("is_fault") Boolean fault
    ) {
        ErrorCode kind = code != null ? ErrorCode.fromCode(code) : ErrorCode.fromName(name);
        return builder(kind)
            .message(message)
            .pluginName(pluginName)
            .dependency(dependency)
            .context(context)
            .source(source)
            .trace(trace)
            .fault(fault != null && fault)
            .build();
    }

    public static Builder builder(ErrorCode kind) {
        return new Builder(kind);
    }

    @JsonIgnore
    public ErrorCode getKind() {
        return kind;
    }

    @JsonProperty("code")
    public int getCode() {
        return kind.getCode();
    }

    @JsonProperty("name")
    public String getName() {
        return kind.wireName();
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("plugin_name")
    public String getPluginName() {
        return pluginName;
    }

    @JsonProperty("dependency")
    public String getDependency() {
        return dependency;
    }

    @JsonProperty("context")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> getContext() {
        return context;
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
    }

    @JsonProperty("trace")
    public String getTrace() {
        return trace;
    }

    @JsonProperty("is_fault")
    public boolean isFault() {
        return fault;
    }

    @JsonIgnore
    public Optional<String> plugin() {
        return Optional.ofNullable(pluginName);
    }

    /**
     * Serialize to the boundary JSON shape.
     *
     * @return JSON text
     */
    public String toJson() {
        return ResultParser.writeErrorDetails(this);
    }

    /**
     * The boundary shape as a map, keyed like {@link #toJson()}.
     *
     * @return ordered map of the non-null fields
     */
    public Map<String, Object> toMap() {
        return ResultParser.toMap(this);
    }

    /**
     * Parse the boundary JSON shape.
     *
     * @param json JSON text produced by {@link #toJson()}
     * @return parsed details
     * @throws QuarryException if the JSON is malformed
     */
    public static ErrorDetails fromJson(String json) throws QuarryException {
        return ResultParser.readErrorDetails(json);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorDetails)) {
            return false;
        }
        ErrorDetails that = (ErrorDetails) o;
        return fault == that.fault
            && kind == that.kind
            && message.equals(that.message)
            && Objects.equals(pluginName, that.pluginName)
            && Objects.equals(dependency, that.dependency)
            && context.equals(that.context)
            && Objects.equals(source, that.source)
            && Objects.equals(trace, that.trace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, pluginName, dependency, context, source, trace, fault);
    }

    @Override
    public String toString() {
        return "ErrorDetails{"
            + "kind=" + kind.wireName()
            + ", message='" + message + '\''
            + (pluginName != null ? ", plugin=" + pluginName : "")
            + (dependency != null ? ", dependency=" + dependency : "")
            + ", fault=" + fault
            + '}';
    }

    public static final class Builder {
        private final ErrorCode kind;
        private String message;
        private String pluginName;
        private String dependency;
        private final Map<String, Object> context = new LinkedHashMap<>();
        private String source;
        private String trace;
        private boolean fault;

        private Builder(ErrorCode kind) {
            this.kind = kind;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder pluginName(String pluginName) {
            this.pluginName = pluginName;
            return this;
        }

        public Builder dependency(String dependency) {
            this.dependency = dependency;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            if (context != null) {
                this.context.putAll(context);
            }
            return this;
        }

        public Builder contextValue(String key, Object value) {
            if (value != null) {
                this.context.put(key, value);
            }
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder trace(String trace) {
            this.trace = trace;
            return this;
        }

        public Builder fault(boolean fault) {
            this.fault = fault;
            return this;
        }

        public ErrorDetails build() {
            return new ErrorDetails(this);
        }
    }
}

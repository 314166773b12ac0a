package org.netpreserve.docketcrawl.cdp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.core.util.Separators.Spacing;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

import static org.netpreserve.docketcrawl.util.LogUtils.ellipses;

/**
 * Maps domain interfaces onto protocol commands and events.
 * <p>
 * Each method of a domain interface becomes the command {@code Domain.method} with the method's parameter names as
 * the command's parameter names (so the code must be compiled with {@code -parameters}). Methods named
 * {@code onSomeEvent} taking a single {@link Consumer} register a listener for {@code Domain.someEvent}. Methods
 * whose name ends with {@code Async} return a {@link CompletionStage} instead of blocking.
 * <p>
 * Events and responses are dispatched on a single thread per connection. Listeners run on that thread and must only
 * send {@code Async} commands.
 */
public abstract class CDPBase {
    private static final Logger log = LoggerFactory.getLogger(CDPBase.class);
    private static final String ASYNC_SUFFIX = "Async";
    private static final ObjectWriter TRACE_WRITER = RPC.JSON.copy()
            .writer().without(JsonWriteFeature.QUOTE_FIELD_NAMES)
            .with(new DefaultPrettyPrinter()
                    .withArrayIndenter(null)
                    .withObjectIndenter(null)
                    .withSeparators(new Separators()
                            .withObjectEntrySpacing(Spacing.AFTER)
                            .withObjectFieldValueSpacing(Spacing.AFTER)));
    private final Map<Long, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<JsonNode>>> listeners = new ConcurrentHashMap<>();
    private final ExecutorService dispatcher;
    private volatile Thread dispatcherThread;
    private volatile Duration commandTimeout = Duration.ofSeconds(120);

    protected CDPBase() {
        String owner = Thread.currentThread().getName();
        dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            var thread = new Thread(runnable, owner + "-CDP");
            thread.setDaemon(true);
            dispatcherThread = thread;
            return thread;
        });
    }

    /**
     * Returns a proxy sending the interface's methods as commands of the domain named after it.
     */
    public <T> T domain(Class<T> domainInterface) {
        return domainInterface.cast(Proxy.newProxyInstance(getClass().getClassLoader(),
                new Class<?>[]{domainInterface}, new DomainHandler(domainInterface)));
    }

    /**
     * Sets how long synchronous commands wait for a response.
     */
    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    protected void handleMessage(RPC.ServerMessage message) {
        try {
            dispatcher.execute(() -> dispatch(message));
        } catch (RejectedExecutionException e) {
            log.atDebug().addKeyValue("message", message).log("Dropping message for a closed connection");
        }
    }

    private void dispatch(RPC.ServerMessage message) {
        if (message instanceof RPC.Response response) {
            completeCommand(response);
        } else if (message instanceof RPC.Event event) {
            fireEvent(event);
        } else {
            log.error("Unknown message type: {}", message);
        }
    }

    private void completeCommand(RPC.Response response) {
        var future = pending.remove(response.id());
        if (future == null) {
            log.atWarn().addKeyValue("id", response.id()).log("Response to unknown command");
        } else if (response.error() != null) {
            future.completeExceptionally(new CDPException(response.error().code(), response.error().message()));
        } else {
            future.complete(response.result());
        }
    }

    private void fireEvent(RPC.Event event) {
        if (log.isTraceEnabled()) {
            log.trace("{}{}", event.method(), ellipses(traceJson(event.params())));
        }
        for (var listener : listeners.getOrDefault(event.method(), List.of())) {
            try {
                listener.accept(event.params());
            } catch (RuntimeException e) {
                log.atError().addKeyValue("event", event.method()).setCause(e).log("Event listener failed");
            }
        }
    }

    static String eventName(Class<?> eventClass) {
        return eventClass.getEnclosingClass().getSimpleName() + "." + decapitalize(eventClass.getSimpleName());
    }

    public <T> void addListener(Class<T> eventClass, Consumer<T> callback) {
        listeners.computeIfAbsent(eventName(eventClass), name -> new CopyOnWriteArrayList<>()).add(params -> {
            try {
                callback.accept(RPC.JSON.treeToValue(params, eventClass));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    Object sendCommand(String method, Map<String, Object> params, Type returnType, Unwrap unwrap) {
        boolean async = returnType instanceof ParameterizedType parameterized
                        && CompletionStage.class.isAssignableFrom((Class<?>) parameterized.getRawType());
        if (!async && Thread.currentThread() == dispatcherThread) {
            throw new IllegalStateException("Sending " + method + " on the event thread would deadlock");
        }
        String command = method.endsWith(ASYNC_SUFFIX)
                ? method.substring(0, method.length() - ASYNC_SUFFIX.length()) : method;
        Type valueType = async ? ((ParameterizedType) returnType).getActualTypeArguments()[0] : returnType;

        long id = nextCommandId();
        var future = new CompletableFuture<JsonNode>();
        if (log.isTraceEnabled()) {
            log.trace("[{}] {}{}", id, command, ellipses(traceJson(params)));
            future.whenComplete((result, error) -> log.trace("[{}] {} [{}]", id,
                    error == null ? ellipses(traceJson(result)) : error.getMessage(), command));
        }
        pending.put(id, future);
        boolean sent = false;
        try {
            sendCommandMessage(id, command, params);
            sent = true;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to send " + command, e);
        } finally {
            if (!sent) pending.remove(id);
        }

        CompletableFuture<Object> result = future.thenApply(json -> readResult(json, valueType, unwrap));
        if (async) return result;
        try {
            return result.get(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw unwrapFailure(e.getCause());
        } catch (TimeoutException e) {
            throw new CDPTimeoutException("Timed out waiting for " + command);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CDPTimeoutException("Interrupted waiting for " + command);
        } finally {
            pending.remove(id);
        }
    }

    private static RuntimeException unwrapFailure(Throwable cause) {
        if (cause instanceof CDPException cdpException) {
            cdpException.actuallyFillInStackTrace();
            return cdpException;
        }
        if (cause instanceof RuntimeException runtimeException) return runtimeException;
        return new RuntimeException(cause);
    }

    private static Object readResult(JsonNode result, Type valueType, Unwrap unwrap) {
        if (valueType == void.class || valueType == Void.class) return null;
        ObjectReader reader = RPC.JSON.reader();
        if (unwrap != null) {
            String field = unwrap.value().isEmpty()
                    ? decapitalize(((Class<?>) valueType).getSimpleName()) : unwrap.value();
            reader = reader.with(DeserializationFeature.UNWRAP_ROOT_VALUE).withRootName(field);
        }
        try {
            return reader.treeToValue(result, RPC.JSON.constructType(valueType));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String traceJson(Object value) {
        try {
            return TRACE_WRITER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String decapitalize(String s) {
        return s.substring(0, 1).toLowerCase(Locale.ROOT) + s.substring(1);
    }

    protected abstract void sendCommandMessage(long commandId, String method, Map<String, Object> params)
            throws IOException;

    protected abstract long nextCommandId();

    protected void close() {
        dispatcher.shutdown();
    }

    /**
     * Fails every command still waiting for a response.
     */
    protected void handleRpcClose() {
        pending.values().forEach(future -> future.completeExceptionally(new CDPClosedException()));
        pending.clear();
    }

    private class DomainHandler implements InvocationHandler {
        private final Class<?> domainInterface;

        DomainHandler(Class<?> domainInterface) {
            this.domainInterface = domainInterface;
        }

        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        public Object invoke(Object proxy, Method method, Object[] args) {
            if (method.getDeclaringClass() == Object.class) {
                return switch (method.getName()) {
                    case "equals" -> proxy == args[0];
                    case "hashCode" -> System.identityHashCode(proxy);
                    default -> domainInterface.getSimpleName() + "@" + System.identityHashCode(proxy);
                };
            }
            var parameters = method.getParameters();
            if (method.getName().startsWith("on") && parameters.length == 1
                && parameters[0].getType() == Consumer.class) {
                var listenerType = (ParameterizedType) method.getGenericParameterTypes()[0];
                addListener((Class<?>) listenerType.getActualTypeArguments()[0], (Consumer) args[0]);
                return null;
            }
            var params = new HashMap<String, Object>();
            for (int i = 0; i < parameters.length; i++) {
                if (args[i] != null) params.put(parameters[i].getName(), args[i]);
            }
            return sendCommand(domainInterface.getSimpleName() + "." + method.getName(), params,
                    method.getGenericReturnType(), method.getAnnotation(Unwrap.class));
        }
    }
}

package io.github.drompincen.aegis.runtime.registry;

import io.github.drompincen.aegis.runtime.context.AgentContext;
import io.github.drompincen.aegis.runtime.context.AgentScope;
import io.github.drompincen.aegis.runtime.monitor.MonitoredAction;
import io.github.drompincen.aegis.runtime.monitor.MonitoredCallInterceptor;

import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * A registered agent. Callables wrapped through the handle are statically
 * bound to this agent; {@link #enter()} opens an ambient scope for code that
 * wraps actions without an explicit agent.
 */
public final class AgentHandle {

    private final String name;
    private final MonitoredCallInterceptor interceptor;

    AgentHandle(String name, MonitoredCallInterceptor interceptor) {
        this.name = name;
        this.interceptor = interceptor;
    }

    public String name() {
        return name;
    }

    public <T> Callable<T> wrap(String actionName, Callable<T> callable) {
        return interceptor.wrap(name, actionName, callable);
    }

    public <I, O> Function<I, O> wrapFunction(String actionName, Function<I, O> function) {
        return interceptor.wrapFunction(name, actionName, function);
    }

    public <T, E extends Exception> T invoke(String actionName, MonitoredAction<T, E> action, Object... args)
            throws E {
        return interceptor.invoke(name, actionName, args, action);
    }

    public <T, E extends Exception> T tryInvoke(String actionName, MonitoredAction<T, E> action, Object... args)
            throws E {
        return interceptor.tryInvoke(name, actionName, args, action);
    }

    public AgentScope enter() {
        return AgentContext.enter(name);
    }
}

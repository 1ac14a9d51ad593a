package com.loopguard.runtime.blocking;

import com.loopguard.runtime.GuardConfigurationException;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import net.bytebuddy.implementation.InvocationHandlerAdapter;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.util.Objects;

import static net.bytebuddy.matcher.ElementMatchers.isDeclaredBy;
import static net.bytebuddy.matcher.ElementMatchers.not;

/**
 * Generates interface proxies that run a hook around every call, with ByteBuddy.
 */
final class ActivityProxyFactory {

    private ActivityProxyFactory() {}

    static <T> T create(Class<T> iface, T target, Runnable hook) {
        Objects.requireNonNull(target, "target");
        if (!iface.isInterface()) {
            throw new GuardConfigurationException(iface.getName() + " is not an interface");
        }

        InvocationHandler handler = (proxy, method, args) -> {
            hook.run();
            try {
                return method.invoke(target, args);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            } finally {
                hook.run();
            }
        };

        Class<?> proxyType = new ByteBuddy()
            .subclass(Object.class)
            .implement(iface)
            .method(not(isDeclaredBy(Object.class)))
            .intercept(InvocationHandlerAdapter.of(handler))
            .make()
            .load(iface.getClassLoader(), ClassLoadingStrategy.Default.WRAPPER)
            .getLoaded();

        try {
            return iface.cast(proxyType.getDeclaredConstructor().newInstance());
        } catch (ReflectiveOperationException e) {
            throw new GuardConfigurationException("Could not proxy " + iface.getName(), e);
        }
    }
}

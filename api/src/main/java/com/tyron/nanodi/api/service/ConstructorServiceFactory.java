package com.tyron.nanodi.api.service;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

/**
 * {@link ServiceFactory} backed by a public constructor of the service class.
 */
final class ConstructorServiceFactory<T> implements ServiceFactory<T> {

    private final Constructor<T> constructor;
    private final boolean contextAware;

    private ConstructorServiceFactory(Constructor<T> constructor, boolean contextAware) {
        this.constructor = constructor;
        this.contextAware = contextAware;
    }

    static <T> ConstructorServiceFactory<T> of(Class<T> type) {
        if (type == null) throw new IllegalArgumentException("type == null");
        if (type.isInterface() || type.isPrimitive() || type.isArray() || Modifier.isAbstract(type.getModifiers())) {
            throw new IllegalArgumentException("Class " + type.getName() + " is not a concrete class.");
        }

        Constructor<T> withContext = findConstructor(type, ServiceContext.class);
        if (withContext != null) {
            return new ConstructorServiceFactory<>(withContext, true);
        }

        Constructor<T> noArg = findConstructor(type);
        if (noArg != null) {
            return new ConstructorServiceFactory<>(noArg, false);
        }

        throw new IllegalArgumentException(
                "Class " + type.getName() + " must have a public constructor(ServiceContext) or a public no-arg constructor.");
    }

    private static <T> Constructor<T> findConstructor(Class<T> type, Class<?>... parameterTypes) {
        try {
            return type.getConstructor(parameterTypes);
        } catch (NoSuchMethodException ignored) {
            return null;
        }
    }

    @Override
    public T create(@NotNull ServiceContext context) {
        try {
            return contextAware ? constructor.newInstance(context) : constructor.newInstance();
        } catch (InvocationTargetException e) {
            // Let the constructor's own failure reach the caller untouched.
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ServiceInstantiationException(
                    "Class " + constructor.getDeclaringClass().getName() + " threw an exception during initialization.", cause);
        } catch (ReflectiveOperationException e) {
            throw new ServiceInstantiationException(
                    "Failed to instantiate " + constructor.getDeclaringClass().getName(), e);
        }
    }

    @Override
    public String toString() {
        return "constructor " + constructor.getDeclaringClass().getName();
    }
}

package com.aiadvent.mcp.context;

import java.util.function.Consumer;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.beans.factory.ObjectProvider;

/** {@link ObjectProvider} over a fixed instance; {@code null} models a missing bean. */
public final class StaticObjectProvider<T> implements ObjectProvider<T> {

  private final T instance;

  public StaticObjectProvider(T instance) {
    this.instance = instance;
  }

  public static <T> StaticObjectProvider<T> empty() {
    return new StaticObjectProvider<>(null);
  }

  @Override
  public T getObject() throws BeansException {
    if (instance == null) {
      throw new NoSuchBeanDefinitionException(Object.class);
    }
    return instance;
  }

  @Override
  public T getObject(Object... args) throws BeansException {
    return getObject();
  }

  @Override
  public T getIfAvailable() throws BeansException {
    return instance;
  }

  @Override
  public T getIfUnique() throws BeansException {
    return instance;
  }

  @Override
  public void ifAvailable(Consumer<T> consumer) throws BeansException {
    if (instance != null) {
      consumer.accept(instance);
    }
  }
}

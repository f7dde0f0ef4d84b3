package com.hcltech.asyncnode.common.function;

@FunctionalInterface
public interface ThrowingSupplier<T> {
    T get() throws Exception;
}

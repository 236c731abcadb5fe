package net.tickwork.core.spi;

@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}

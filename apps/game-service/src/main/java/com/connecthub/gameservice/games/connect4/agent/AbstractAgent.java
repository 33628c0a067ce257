package com.connecthub.gameservice.games.connect4.agent;

import java.util.Objects;

/**
 * 参与者基类：只负责持有外部 token。
 * 选步与结果处理由子类实现。
 */
public abstract class AbstractAgent<T> implements Agent<T> {

    private final T token;

    protected AbstractAgent(T token) {
        this.token = Objects.requireNonNull(token, "token");
    }

    @Override
    public T token() {
        return token;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + token + "]";
    }
}

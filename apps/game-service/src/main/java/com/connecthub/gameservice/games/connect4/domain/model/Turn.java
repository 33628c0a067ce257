package com.connecthub.gameservice.games.connect4.domain.model;

/** 行棋记录中的一条：谁（外部 token）做了什么动作 */
public record Turn<T>(T token, Action action) {

    @Override
    public String toString() {
        return token + ", " + action;
    }
}

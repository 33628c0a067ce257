package com.connecthub.gameservice.games.connect4.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.Random;

/**
 * 对局选项。
 * - random：决定行棋顺序的随机源，测试时传固定种子；
 * - maxAttempts：同一回合内列已满时最多询问几次，用完判负。
 */
@Getter
@Builder
public class GameOptions {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    @Builder.Default
    private final Random random = new Random();

    @Builder.Default
    private final int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    public static GameOptions defaults() {
        return GameOptions.builder().build();
    }
}

package com.connecthub.gameservice.games.connect4.agent;

import com.connecthub.gameservice.games.connect4.domain.enums.PlayerType;
import lombok.RequiredArgsConstructor;

import java.io.BufferedReader;
import java.io.PrintStream;
import java.util.Random;

/**
 * 按配置的玩家类型创建参与者。命令行玩家共用同一对输入输出流。
 */
@RequiredArgsConstructor
public class AgentFactory {

    private final BufferedReader in;
    private final PrintStream out;
    private final Random random;

    public Agent<String> create(String token, PlayerType type) {
        return switch (type) {
            case HUMAN -> new ConsoleAgent<>(token, in, out);
            case RANDOM -> new RandomAgent<>(token, random);
        };
    }
}

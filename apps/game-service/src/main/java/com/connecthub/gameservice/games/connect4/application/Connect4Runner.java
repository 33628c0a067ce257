package com.connecthub.gameservice.games.connect4.application;

import com.connecthub.gameservice.games.connect4.agent.Agent;
import com.connecthub.gameservice.games.connect4.agent.AgentFactory;
import com.connecthub.gameservice.games.connect4.domain.dto.OutcomeRecordConverter;
import com.connecthub.gameservice.games.connect4.domain.model.BoardSize;
import com.connecthub.gameservice.games.connect4.domain.model.Game;
import com.connecthub.gameservice.games.connect4.domain.model.GameOptions;
import com.connecthub.gameservice.games.connect4.domain.model.Outcome;
import com.connecthub.gameservice.platform.config.Connect4Properties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 进程入口的薄封装：按配置创建玩家与对局，play 一盘，把结果以 JSON 写日志。
 */
@Slf4j
@RequiredArgsConstructor
public class Connect4Runner implements CommandLineRunner {

    private final Connect4Properties props;
    private final ObjectMapper objectMapper;
    private final BufferedReader in;
    private final PrintStream out;

    public Connect4Runner(Connect4Properties props, ObjectMapper objectMapper) {
        this(props, objectMapper,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    @Override
    public void run(String... args) {
        Outcome<String> outcome = playOnce();
        out.println(outcome);
        try {
            log.info("对局记录 {}", objectMapper.writeValueAsString(OutcomeRecordConverter.toRecord(outcome)));
        } catch (JsonProcessingException e) {
            log.warn("对局记录序列化失败 gameId={}", outcome.getGameId(), e);
        }
    }

    /** 按当前配置打一盘 */
    public Outcome<String> playOnce() {
        Random random = props.getSeed() == null ? new Random() : new Random(props.getSeed());
        AgentFactory factory = new AgentFactory(in, out, random);
        List<Agent<String>> agents = new ArrayList<>();
        for (Connect4Properties.Player p : props.getPlayers()) {
            agents.add(factory.create(p.getToken(), p.getType()));
        }
        Game<String> game = new Game<>(agents,
                new BoardSize(props.getBoard().getRows(), props.getBoard().getColumns()),
                GameOptions.builder().random(random).maxAttempts(props.getMaxAttempts()).build());
        return game.play();
    }
}

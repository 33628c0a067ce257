package com.connecthub.gameservice.games.connect4.domain.model;

import com.connecthub.gameservice.games.connect4.agent.Agent;
import com.connecthub.gameservice.games.connect4.domain.enums.AgentResult;
import com.connecthub.gameservice.games.connect4.domain.enums.GamePhase;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * 一盘对局的结果与行棋记录。
 * - results：每个参与者 -> 结果，按登记顺序，开局时全部为 PENDING；
 * - record：成功执行的 (token, Action)，可用于回放/审计。
 * 只有编排方 Game 能修改（包内可见的方法），终局后再改会抛 IllegalStateException。
 */
public class Outcome<T> {

    /** 棋局ID（UUID） */
    @Getter
    private final String gameId;

    private final Map<Agent<T>, AgentResult> results = new LinkedHashMap<>();

    private final List<Turn<T>> record = new ArrayList<>();

    @Getter
    private GamePhase phase = GamePhase.NOT_STARTED;

    /** 胜者 token；未结束或和棋为 null */
    @Getter
    private T winner;

    /** 因多次非法动作被判负的 token；没有则为 null */
    @Getter
    private T forfeitedBy;

    public Outcome(String gameId, List<? extends Agent<T>> agents) {
        this.gameId = gameId;
        for (Agent<T> agent : agents) {
            results.put(agent, AgentResult.PENDING);
        }
    }

    /** 参与者 -> 结果（只读） */
    public Map<Agent<T>, AgentResult> getResults() {
        return Collections.unmodifiableMap(results);
    }

    /** 行棋记录（只读），长度等于成功落子次数 */
    public List<Turn<T>> getRecord() {
        return Collections.unmodifiableList(record);
    }

    public AgentResult resultOf(Agent<T> agent) {
        AgentResult result = results.get(agent);
        if (result == null) {
            throw new IllegalArgumentException("AGENT_NOT_IN_GAME: " + agent);
        }
        return result;
    }

    public AgentResult resultOf(T token) {
        return results.get(agentOf(token));
    }

    public boolean isFinished() {
        return phase.isTerminal();
    }

    // --------- 状态变更（仅供 Game 调用） ----------

    void start() {
        if (phase != GamePhase.NOT_STARTED) {
            throw new IllegalStateException("OUTCOME_ALREADY_STARTED: " + gameId);
        }
        phase = GamePhase.IN_PROGRESS;
    }

    void appendToRecord(T token, Action action) {
        ensureInProgress();
        record.add(new Turn<>(token, action));
    }

    /** 胜者 WIN，其余 LOSE */
    void declareWin(T winnerToken) {
        ensureInProgress();
        Agent<T> winnerAgent = agentOf(winnerToken);
        results.replaceAll((agent, r) -> agent == winnerAgent ? AgentResult.WIN : AgentResult.LOSE);
        this.winner = winnerToken;
        this.phase = GamePhase.WON;
    }

    /** 全员 DRAW */
    void declareDraw() {
        ensureInProgress();
        results.replaceAll((agent, r) -> AgentResult.DRAW);
        this.phase = GamePhase.DRAWN;
    }

    /** 判负：该方 LOSE，其余全部 WIN */
    void declareForfeit(T loserToken) {
        ensureInProgress();
        Agent<T> loser = agentOf(loserToken);
        results.replaceAll((agent, r) -> agent == loser ? AgentResult.LOSE : AgentResult.WIN);
        this.forfeitedBy = loserToken;
        this.phase = GamePhase.WON;
    }

    // ----------- private helpers -----------

    private void ensureInProgress() {
        if (phase != GamePhase.IN_PROGRESS) {
            throw new IllegalStateException("OUTCOME_NOT_IN_PROGRESS: " + gameId + " is " + phase);
        }
    }

    private Agent<T> agentOf(T token) {
        for (Agent<T> agent : results.keySet()) {
            if (Objects.equals(agent.token(), token)) return agent;
        }
        throw new IllegalArgumentException("UNKNOWN_TOKEN: " + token);
    }

    @Override
    public String toString() {
        StringJoiner s = new StringJoiner(System.lineSeparator());
        s.add("Agent outcomes");
        results.forEach((agent, result) -> s.add(agent.token() + ": " + result));
        s.add("Action record");
        record.forEach(turn -> s.add(turn.toString()));
        return s.toString();
    }
}

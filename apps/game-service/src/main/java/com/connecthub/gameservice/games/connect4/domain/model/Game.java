package com.connecthub.gameservice.games.connect4.domain.model;

import com.connecthub.gameservice.engine.core.TurnOrder;
import com.connecthub.gameservice.games.connect4.agent.Agent;
import com.connecthub.gameservice.games.connect4.domain.exception.ActionException;
import com.connecthub.gameservice.games.connect4.domain.exception.ProtocolViolationException;
import com.connecthub.gameservice.games.connect4.domain.rule.Verdict;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * 一局游戏：编排方/裁判，负责参与者与状态之间的全部交互。
 * 流程：
 * 1) 开局洗牌一次确定行棋顺序，之后固定循环；
 * 2) 每回合给当前参与者一份新快照，拿回 Action；
 * 3) 结构校验（类型、列范围）失败 -> ProtocolViolationException，直接中止；
 * 4) 交给状态执行，列已满 -> 重新询问同一参与者，超过 maxAttempts 判负；
 * 5) 成功后记入行棋记录并判定终局；
 * 6) 终局后依次通知所有参与者。
 */
@Slf4j
public class Game<T> {

    @Getter
    private final String gameId = UUID.randomUUID().toString();
    private final List<Agent<T>> agents;
    @Getter
    private final BoardSize boardSize;
    private final GameOptions options;
    private boolean played = false;

    public Game(List<? extends Agent<T>> agents) {
        this(agents, BoardSize.DEFAULT, GameOptions.defaults());
    }

    public Game(List<? extends Agent<T>> agents, BoardSize boardSize) {
        this(agents, boardSize, GameOptions.defaults());
    }

    public Game(List<? extends Agent<T>> agents, BoardSize boardSize, GameOptions options) {
        if (agents == null || agents.size() < 2) {
            throw new IllegalArgumentException("NOT_ENOUGH_AGENTS: at least 2 agents are required");
        }
        if (boardSize == null) {
            throw new IllegalArgumentException("BOARD_SIZE_NULL");
        }
        if (options == null || options.getRandom() == null) {
            throw new IllegalArgumentException("OPTIONS_NULL");
        }
        if (options.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("MAX_ATTEMPTS_NOT_POSITIVE: " + options.getMaxAttempts());
        }
        Set<T> seen = new HashSet<>();
        for (Agent<T> agent : agents) {
            if (agent == null) {
                throw new IllegalArgumentException("AGENT_NULL");
            }
            if (agent.token() == null) {
                throw new IllegalArgumentException("TOKEN_NULL: " + agent);
            }
            if (!seen.add(agent.token())) {
                throw new IllegalArgumentException("TOKEN_DUPLICATE: " + agent.token());
            }
        }
        this.agents = List.copyOf(agents);
        this.boardSize = boardSize;
        this.options = options;
    }

    /**
     * 进行整盘对局，直到有人获胜或和棋。每个 Game 只能 play 一次。
     * @throws ProtocolViolationException 参与者返回了结构上非法的动作（不会通知参与者）
     */
    public Outcome<T> play() {
        if (played) {
            throw new IllegalStateException("GAME_ALREADY_PLAYED: " + gameId);
        }
        played = true;

        // 开局前准备：顺序、状态、结果
        TurnOrder<Agent<T>> order = new TurnOrder<>(agents, options.getRandom());
        List<T> tokens = new ArrayList<>(agents.size());
        for (Agent<T> agent : agents) tokens.add(agent.token());
        Connect4State<T> state = new Connect4State<>(tokens, boardSize);
        Outcome<T> outcome = new Outcome<>(gameId, agents);
        outcome.start();
        log.info("对局开始 gameId={} board={} order={}", gameId, boardSize, order.order());

        while (!outcome.isFinished()) {
            Agent<T> current = order.next();
            if (!takeTurn(current, state, outcome)) {
                log.warn("判负 gameId={} token={} 连续 {} 次非法落子", gameId, current.token(), options.getMaxAttempts());
                outcome.declareForfeit(current.token());
                break;
            }

            Verdict<T> verdict = state.checkOutcome();
            switch (verdict.status()) {
                case WIN -> outcome.declareWin(verdict.winner());
                case DRAW -> outcome.declareDraw();
                case UNFINISHED -> {
                    // 继续下一位
                }
            }
        }
        log.info("对局结束 gameId={} phase={} winner={} moves={}",
                gameId, outcome.getPhase(), outcome.getWinner(), outcome.getRecord().size());

        notifyAgents(outcome);
        return outcome;
    }

    /**
     * 当前参与者的一个回合。
     * @return 成功落子返回 true；maxAttempts 次都被状态拒绝返回 false
     */
    private boolean takeTurn(Agent<T> current, Connect4State<T> state, Outcome<T> outcome) {
        for (int attempt = 1; attempt <= options.getMaxAttempts(); attempt++) {
            Action action = current.selectAction(state.exposeView());
            // 结构校验与局面无关，先于落子
            validate(current, action);
            try {
                int row = state.place(action.column(), current.token());
                outcome.appendToRecord(current.token(), action);
                if (log.isDebugEnabled()) {
                    log.debug("落子 gameId={} token={} column={} row={}{}{}", gameId, current.token(),
                            action.column(), row, System.lineSeparator(), state.render());
                }
                return true;
            } catch (ActionException e) {
                log.warn("非法落子 gameId={} token={} attempt={}/{}: {}",
                        gameId, current.token(), attempt, options.getMaxAttempts(), e.getMessage());
            }
        }
        return false;
    }

    /** 结构校验：动作非空、类型已知、列在 [1, columns] 内 */
    private void validate(Agent<T> agent, Action action) {
        if (action == null) {
            throw new ProtocolViolationException("ACTION_NULL: agent " + agent.token() + " returned no action");
        }
        if (action.kind() == null) {
            throw new ProtocolViolationException("ACTION_KIND_NULL: agent " + agent.token());
        }
        switch (action.kind()) {
            case PLACE -> {
                Integer column = action.column();
                if (column == null) {
                    throw new ProtocolViolationException("COLUMN_NULL: agent " + agent.token());
                }
                if (column < 1 || column > boardSize.columns()) {
                    throw new ProtocolViolationException("COLUMN_OUT_OF_RANGE: agent " + agent.token()
                            + " chose " + column + ", must lie within [1, " + boardSize.columns() + "]");
                }
            }
        }
    }

    /** 终局通知：单个参与者抛异常不影响其他参与者 */
    private void notifyAgents(Outcome<T> outcome) {
        for (Agent<T> agent : agents) {
            try {
                agent.notifyOutcome(outcome);
            } catch (RuntimeException e) {
                log.warn("终局通知失败 gameId={} token={}", gameId, agent.token(), e);
            }
        }
    }
}

package com.connecthub.gameservice.games.connect4.agent;

import com.connecthub.gameservice.games.connect4.domain.model.Action;
import com.connecthub.gameservice.games.connect4.domain.model.Outcome;
import com.connecthub.gameservice.games.connect4.domain.model.StateView;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Random;

/**
 * 随机参与者：在还没满的列里均匀随机选一列。
 */
@Slf4j
public class RandomAgent<T> extends AbstractAgent<T> {

    private final Random random;

    public RandomAgent(T token, Random random) {
        super(token);
        this.random = random;
    }

    @Override
    public Action selectAction(StateView<T> view) {
        List<Integer> open = view.openColumns();
        if (open.isEmpty()) {
            // 编排方在棋盘满之前就会判和，走到这里说明调用方有问题
            throw new IllegalStateException("NO_OPEN_COLUMN: " + token());
        }
        return Action.place(open.get(random.nextInt(open.size())));
    }

    @Override
    public void notifyOutcome(Outcome<T> outcome) {
        log.debug("RandomAgent {} 结果: {}", token(), outcome.resultOf(this));
    }
}

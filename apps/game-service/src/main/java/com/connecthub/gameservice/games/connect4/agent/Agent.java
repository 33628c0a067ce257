package com.connecthub.gameservice.games.connect4.agent;

import com.connecthub.gameservice.engine.core.Participant;
import com.connecthub.gameservice.games.connect4.domain.model.Action;
import com.connecthub.gameservice.games.connect4.domain.model.Outcome;
import com.connecthub.gameservice.games.connect4.domain.model.StateView;

/**
 * 四子棋参与者契约。
 * 每个参与者持有一个本局内唯一的外部 token（用 equals 比较），
 * 编排方 Game 每回合给它一份新的 StateView，要求返回一个 Action；终局后回调 notifyOutcome。
 */
public interface Agent<T> extends Participant<StateView<T>, Action, Outcome<T>> {

    /** 本参与者棋子的外部标识 */
    T token();
}

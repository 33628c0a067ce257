package com.connecthub.gameservice.games.connect4.domain.dto;

import com.connecthub.gameservice.games.connect4.domain.model.Outcome;
import com.connecthub.gameservice.games.connect4.domain.model.Turn;

import java.util.List;

/**
 * Outcome -> OutcomeRecord 转换工具
 * 用于日志/审计输出。
 */
public class OutcomeRecordConverter {

    private OutcomeRecordConverter() {
    }

    public static <T> OutcomeRecord toRecord(Outcome<T> outcome) {
        OutcomeRecord rec = new OutcomeRecord();
        rec.setGameId(outcome.getGameId());
        rec.setPhase(outcome.getPhase().name());
        rec.setWinner(stringOf(outcome.getWinner()));
        rec.setForfeitedBy(stringOf(outcome.getForfeitedBy()));
        outcome.getResults().forEach((agent, result) ->
                rec.getResults().put(String.valueOf(agent.token()), result.name()));

        List<Turn<T>> turns = outcome.getRecord();
        for (int i = 0; i < turns.size(); i++) {
            Turn<T> turn = turns.get(i);
            OutcomeRecord.Step step = new OutcomeRecord.Step();
            step.setStep(i + 1);
            step.setToken(String.valueOf(turn.token()));
            step.setAction(turn.action().kind().name());
            step.setColumn(turn.action().column());
            rec.getRecord().add(step);
        }
        return rec;
    }

    private static String stringOf(Object o) {
        return o == null ? null : String.valueOf(o);
    }
}

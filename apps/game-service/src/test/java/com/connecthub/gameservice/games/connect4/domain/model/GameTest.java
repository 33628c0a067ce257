package com.connecthub.gameservice.games.connect4.domain.model;

import com.connecthub.gameservice.games.connect4.agent.Agent;
import com.connecthub.gameservice.games.connect4.agent.RandomAgent;
import com.connecthub.gameservice.games.connect4.domain.enums.ActionKind;
import com.connecthub.gameservice.games.connect4.domain.enums.AgentResult;
import com.connecthub.gameservice.games.connect4.domain.enums.GamePhase;
import com.connecthub.gameservice.games.connect4.domain.exception.ProtocolViolationException;
import com.connecthub.gameservice.games.connect4.support.FixedOrderRandom;
import com.connecthub.gameservice.games.connect4.support.ScriptedAgent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Game")
class GameTest {

    private static GameOptions identityOrder() {
        return GameOptions.builder().random(FixedOrderRandom.identity()).build();
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        void needsAtLeastTwoAgents() {
            ScriptedAgent x = ScriptedAgent.placing("X");
            assertThatThrownBy(() -> new Game<>(List.of(x)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("NOT_ENOUGH_AGENTS");
            assertThatThrownBy(() -> new Game<String>(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void rejectsNonPositiveDimensions() {
            List<ScriptedAgent> agents = List.of(ScriptedAgent.placing("X"), ScriptedAgent.placing("O"));
            assertThatThrownBy(() -> new Game<>(agents, new BoardSize(0, 7)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new Game<>(agents, new BoardSize(6, -2)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void rejectsDuplicateAndNullTokens() {
            assertThatThrownBy(() -> new Game<>(List.of(ScriptedAgent.placing("X"), ScriptedAgent.placing("X"))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("TOKEN_DUPLICATE");
            assertThatThrownBy(() -> new Game<>(Arrays.asList(ScriptedAgent.placing("X"), null)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("AGENT_NULL");
        }

        @Test
        void rejectsNonPositiveAttemptBudget() {
            List<ScriptedAgent> agents = List.of(ScriptedAgent.placing("X"), ScriptedAgent.placing("O"));
            GameOptions options = GameOptions.builder().maxAttempts(0).build();
            assertThatThrownBy(() -> new Game<>(agents, BoardSize.DEFAULT, options))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("MAX_ATTEMPTS_NOT_POSITIVE");
        }
    }

    @Test
    @DisplayName("X stacks four in column 4 and wins whoever moves first")
    void verticalWin() {
        for (Random random : List.of(FixedOrderRandom.identity(), FixedOrderRandom.swapped(), new Random(42))) {
            ScriptedAgent x = ScriptedAgent.placing("X", 4, 4, 4, 4);
            ScriptedAgent o = ScriptedAgent.placing("O", 1, 2, 1, 2);
            Game<String> game = new Game<>(List.of(x, o), BoardSize.DEFAULT,
                    GameOptions.builder().random(random).build());

            Outcome<String> outcome = game.play();

            assertThat(outcome.getPhase()).isEqualTo(GamePhase.WON);
            assertThat(outcome.getWinner()).isEqualTo("X");
            assertThat(outcome.resultOf(x)).isEqualTo(AgentResult.WIN);
            assertThat(outcome.resultOf(o)).isEqualTo(AgentResult.LOSE);
            assertThat(outcome.getRecord().get(outcome.getRecord().size() - 1))
                    .isEqualTo(new Turn<>("X", Action.place(4)));
            assertThat(outcome.getRecord().stream().filter(t -> t.token().equals("X"))).hasSize(4);
            assertThat(x.outcomes).containsExactly(outcome);
            assertThat(o.outcomes).containsExactly(outcome);
        }
    }

    @Test
    @DisplayName("record holds every successful placement in order")
    void recordMatchesPlacements() {
        ScriptedAgent x = ScriptedAgent.placing("X", 4, 4, 4, 4);
        ScriptedAgent o = ScriptedAgent.placing("O", 1, 2, 1);
        Outcome<String> outcome = new Game<>(List.of(x, o), BoardSize.DEFAULT, identityOrder()).play();

        assertThat(outcome.getRecord()).containsExactly(
                new Turn<>("X", Action.place(4)),
                new Turn<>("O", Action.place(1)),
                new Turn<>("X", Action.place(4)),
                new Turn<>("O", Action.place(2)),
                new Turn<>("X", Action.place(4)),
                new Turn<>("O", Action.place(1)),
                new Turn<>("X", Action.place(4)));
        assertThat(outcome.getGameId()).isNotBlank();
    }

    @Test
    @DisplayName("agents see a fresh view with the pieces placed so far")
    void agentsReceiveFreshViews() {
        ScriptedAgent x = ScriptedAgent.placing("X", 4, 4, 4, 4);
        ScriptedAgent o = ScriptedAgent.placing("O", 1, 2, 1);
        new Game<>(List.of(x, o), BoardSize.DEFAULT, identityOrder()).play();

        assertThat(x.views.get(0).board()).containsOnlyNulls();
        StateView<String> oFirst = o.views.get(0);
        assertThat(oFirst.tokenAt(5, 3)).isEqualTo("X");
        assertThat(oFirst.board()).containsOnly(null, "X");
        assertThat(x.views.get(0)).isNotSameAs(x.views.get(1));
    }

    @Test
    @DisplayName("filling a 6x7 board without four in a row ends in a draw")
    void fullBoardDraw() {
        ScriptedAgent x = ScriptedAgent.placing("X",
                3, 1, 1, 1, 2, 2, 2, 3, 3, 4, 4, 4, 7, 5, 5, 5, 6, 6, 6, 7, 7);
        ScriptedAgent o = ScriptedAgent.placing("O",
                1, 1, 1, 2, 2, 2, 3, 3, 3, 4, 4, 4, 5, 5, 5, 6, 6, 6, 7, 7, 7);

        Outcome<String> outcome = new Game<>(List.of(x, o), BoardSize.DEFAULT, identityOrder()).play();

        assertThat(outcome.getPhase()).isEqualTo(GamePhase.DRAWN);
        assertThat(outcome.getWinner()).isNull();
        assertThat(outcome.getResults()).containsValues(AgentResult.DRAW).doesNotContainValue(AgentResult.WIN);
        assertThat(outcome.getRecord()).hasSize(42);
        assertThat(x.remaining()).isZero();
        assertThat(o.remaining()).isZero();
    }

    @Test
    @DisplayName("turn order is fixed and cyclic over the whole game")
    void cyclicTurnOrder() {
        Random random = new Random(2024);
        List<Agent<String>> agents = List.of(
                new RandomAgent<>("A", random), new RandomAgent<>("B", random), new RandomAgent<>("C", random));
        Outcome<String> outcome = new Game<>(agents, new BoardSize(8, 9),
                GameOptions.builder().random(new Random(7)).build()).play();

        List<Turn<String>> record = outcome.getRecord();
        assertThat(record.size()).isGreaterThanOrEqualTo(7);
        assertThat(List.of(record.get(0).token(), record.get(1).token(), record.get(2).token()))
                .containsExactlyInAnyOrder("A", "B", "C");
        for (int i = 0; i < record.size(); i++) {
            assertThat(record.get(i).token()).isEqualTo(record.get(i % 3).token());
        }
        assertThat(outcome.isFinished()).isTrue();
    }

    @Nested
    @DisplayName("full column")
    class FullColumn {

        @Test
        @DisplayName("the same agent is asked again and the rejected action is not recorded")
        void repromptsSameAgent() {
            // 2 行 4 列：第 1 列两步就满
            ScriptedAgent x = ScriptedAgent.placing("X", 1, 1, 2, 3, 4);
            ScriptedAgent o = ScriptedAgent.placing("O", 1, 2, 3);

            Outcome<String> outcome = new Game<>(List.of(x, o), new BoardSize(2, 4), identityOrder()).play();

            assertThat(x.views).hasSize(5);
            assertThat(outcome.getRecord()).extracting(Turn::token)
                    .containsExactly("X", "O", "X", "O", "X", "O", "X");
            assertThat(outcome.getRecord().get(2).action()).isEqualTo(Action.place(2));
            assertThat(outcome.getWinner()).isEqualTo("X");
            assertThat(outcome.getForfeitedBy()).isNull();
        }

        @Test
        @DisplayName("running out of attempts forfeits the game")
        void forfeitsAfterBudget() {
            ScriptedAgent x = ScriptedAgent.placing("X", 1);
            ScriptedAgent o = ScriptedAgent.placing("O", 1, 1, 1);
            GameOptions options = GameOptions.builder().random(FixedOrderRandom.identity()).maxAttempts(2).build();

            Outcome<String> outcome = new Game<>(List.of(x, o), new BoardSize(1, 4), options).play();

            assertThat(o.views).hasSize(2);
            assertThat(o.remaining()).isEqualTo(1);
            assertThat(outcome.getForfeitedBy()).isEqualTo("O");
            assertThat(outcome.getPhase()).isEqualTo(GamePhase.WON);
            assertThat(outcome.resultOf("O")).isEqualTo(AgentResult.LOSE);
            assertThat(outcome.resultOf("X")).isEqualTo(AgentResult.WIN);
            assertThat(outcome.getRecord()).containsExactly(new Turn<>("X", Action.place(1)));
            assertThat(x.outcomes).hasSize(1);
            assertThat(o.outcomes).hasSize(1);
        }
    }

    @Nested
    @DisplayName("protocol violations")
    class ProtocolViolations {

        private void assertFatal(Action bad, String code) {
            ScriptedAgent x = new ScriptedAgent("X", Arrays.asList(bad));
            ScriptedAgent o = ScriptedAgent.placing("O", 1);
            Game<String> game = new Game<>(List.of(x, o), BoardSize.DEFAULT, identityOrder());

            assertThatThrownBy(game::play)
                    .isInstanceOf(ProtocolViolationException.class)
                    .hasMessageContaining(code);
            assertThat(x.outcomes).isEmpty();
            assertThat(o.outcomes).isEmpty();
        }

        @Test
        void columnBelowRange() {
            assertFatal(Action.place(0), "COLUMN_OUT_OF_RANGE");
        }

        @Test
        void columnAboveRange() {
            assertFatal(Action.place(8), "COLUMN_OUT_OF_RANGE");
        }

        @Test
        void missingAction() {
            assertFatal(null, "ACTION_NULL");
        }

        @Test
        void missingKindOrColumn() {
            assertFatal(new Action(null, 3), "ACTION_KIND_NULL");
            assertFatal(new Action(ActionKind.PLACE, null), "COLUMN_NULL");
        }

        @Test
        @SuppressWarnings("unchecked")
        void misbehavingAgentIsNeverNotified() {
            Agent<String> broken = mock(Agent.class);
            when(broken.token()).thenReturn("B");
            when(broken.selectAction(any())).thenReturn(Action.place(99));
            ScriptedAgent o = ScriptedAgent.placing("O", 1);

            Game<String> game = new Game<>(List.of(broken, o), BoardSize.DEFAULT, identityOrder());

            assertThatThrownBy(game::play).isInstanceOf(ProtocolViolationException.class);
            verify(broken, never()).notifyOutcome(any());
        }
    }

    @Test
    @DisplayName("a failing notification does not stop the others")
    void notificationFailureIsIsolated() {
        List<String> notified = new ArrayList<>();
        ScriptedAgent x = new ScriptedAgent("X", List.of(Action.place(1), Action.place(1), Action.place(1), Action.place(1))) {
            @Override
            public void notifyOutcome(Outcome<String> outcome) {
                notified.add("X");
                throw new IllegalStateException("boom");
            }
        };
        ScriptedAgent o = ScriptedAgent.placing("O", 2, 2, 2);

        Outcome<String> outcome = new Game<>(List.of(x, o), BoardSize.DEFAULT, identityOrder()).play();

        assertThat(outcome.getWinner()).isEqualTo("X");
        assertThat(notified).containsExactly("X");
        assertThat(o.outcomes).containsExactly(outcome);
    }

    @Test
    void playsOnlyOnce() {
        Game<String> game = new Game<>(List.of(
                ScriptedAgent.placing("X", 1, 1, 1, 1), ScriptedAgent.placing("O", 2, 2, 2)),
                BoardSize.DEFAULT, identityOrder());
        game.play();

        assertThatThrownBy(game::play)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GAME_ALREADY_PLAYED");
    }
}

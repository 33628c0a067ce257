package com.connecthub.gameservice.games.connect4.agent;

import com.connecthub.gameservice.games.connect4.domain.constants.GameMessages;
import com.connecthub.gameservice.games.connect4.domain.model.Action;
import com.connecthub.gameservice.games.connect4.domain.model.Outcome;
import com.connecthub.gameservice.games.connect4.domain.model.StateView;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * 命令行参与者：打印棋盘，读一行输入作为列号。
 * 非整数、越界、已满的列都会在本地提示并重新输入，不会把坏输入交给编排方。
 */
public class ConsoleAgent<T> extends AbstractAgent<T> {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleAgent(T token, BufferedReader in, PrintStream out) {
        super(token);
        this.in = in;
        this.out = out;
    }

    @Override
    public Action selectAction(StateView<T> view) {
        out.println(view.render());
        while (true) {
            out.print(GameMessages.formatToPlay(token()) + " ");
            out.flush();
            String line = readLine();

            int column;
            try {
                column = Integer.parseInt(line.trim());
            } catch (NumberFormatException e) {
                out.println(GameMessages.NOT_AN_INTEGER);
                continue;
            }
            if (column < 1 || column > view.columns()) {
                out.println(GameMessages.formatColumnOutOfBoard(view.columns()));
                continue;
            }
            if (!view.isColumnOpen(column)) {
                out.println(GameMessages.formatColumnFull(column));
                continue;
            }
            return Action.place(column);
        }
    }

    @Override
    public void notifyOutcome(Outcome<T> outcome) {
        out.println(GameMessages.formatAgentResult(token(), outcome.resultOf(this)));
    }

    private String readLine() {
        try {
            String line = in.readLine();
            if (line == null) {
                throw new IllegalStateException(GameMessages.INPUT_CLOSED);
            }
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package com.connecthub.gameservice.platform.config;

import com.connecthub.gameservice.games.connect4.domain.enums.PlayerType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * 四子棋对局相关配置。
 *
 * 提供棋盘尺寸 / 玩家列表 / 非法落子重试次数 / 随机种子。
 * 支持通过 application.yml 或环境变量覆盖。
 */
@Data
@Validated
@ConfigurationProperties(prefix = "connect4")
public class Connect4Properties {

    @Valid
    private Board board = new Board();

    /**
     * 同一回合内列已满时最多询问几次，用完判负
     */
    @Min(1)
    private int maxAttempts = 3;

    /**
     * 随机种子；为空时每局随机
     */
    private Long seed;

    /**
     * 玩家列表（至少 2 个，token 不能重复）
     */
    @Valid
    @Size(min = 2)
    private List<Player> players = new ArrayList<>(List.of(
            new Player("X", PlayerType.HUMAN),
            new Player("O", PlayerType.RANDOM)));

    @Valid
    private Runner runner = new Runner();

    @Data
    public static class Board {
        /** 行数，默认 6 */
        @Min(1)
        private int rows = 6;
        /** 列数，默认 7 */
        @Min(1)
        private int columns = 7;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Player {
        @NotBlank
        private String token;
        @NotNull
        private PlayerType type = PlayerType.RANDOM;
    }

    @Data
    public static class Runner {
        /** 是否在启动后自动开一局（测试里关闭） */
        private boolean enabled = true;
    }
}

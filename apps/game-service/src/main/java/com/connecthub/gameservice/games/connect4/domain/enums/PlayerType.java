package com.connecthub.gameservice.games.connect4.domain.enums;

/** 参与者类型：HUMAN=命令行人类玩家；RANDOM=随机落子 */
public enum PlayerType {

    //命令行输入
    HUMAN,
    //在未满的列中随机选
    RANDOM
}

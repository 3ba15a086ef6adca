package com.blockhub.gameservice.games.tetris.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对局配置（房主在 waiting 阶段可修改）。
 * 也是 change_config 指令的载荷：{"cols":10,"rows":20,"name":"..."}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameConfig {
    /** 列数 */
    private int cols;
    /** 行数 */
    private int rows;
    /** 对局名称（大厅展示） */
    private String name;

    /** 行列必须为正数 */
    @JsonIgnore
    public boolean isValid() {
        return cols > 0 && rows > 0;
    }
}

package com.asiainfo.cube.core.generator;

import com.asiainfo.cube.core.model.Field;

/**
 * 查询输出列 -> 解码目标
 *
 * @param alias     SQL 列别名
 * @param field     所属字段
 * @param attribute 组合维度属性；null 表示字段本身的标量值
 */
public record OutputColumn(String alias, Field field, String attribute) {
}

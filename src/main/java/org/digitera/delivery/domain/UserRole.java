package org.digitera.delivery.domain;

/**
 * 用户角色
 * - BUYER: 买家（注册默认）
 * - CREATOR: 创作者（由买家单向升级，仅一次）
 */
public enum UserRole {
    BUYER,
    CREATOR
}

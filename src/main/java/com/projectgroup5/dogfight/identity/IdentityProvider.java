package com.projectgroup5.dogfight.identity;

/**
 * 把 join 消息里的名字和令牌解析成玩家身份
 * 实现可以拒绝（抛 ValidationException），连接会收到 error
 */
public interface IdentityProvider {

    PlayerIdentity resolve(String requestedName, String token);
}

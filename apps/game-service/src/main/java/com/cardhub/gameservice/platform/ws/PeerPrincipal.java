package com.cardhub.gameservice.platform.ws;

import java.security.Principal;

/** 以 peerId 作为 STOMP 会话用户名 */
public record PeerPrincipal(String name) implements Principal {

    @Override
    public String getName() {
        return name;
    }
}

package com.jz.crm.notify;

import java.io.IOException;

/** One live connection to an operator desk. */
public interface OperatorChannel {

    void send(String payload) throws IOException;

    boolean isOpen();
}

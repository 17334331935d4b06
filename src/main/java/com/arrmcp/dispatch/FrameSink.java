package com.arrmcp.dispatch;

import java.io.IOException;

@FunctionalInterface
public interface FrameSink {
    void accept(ToolResponse frame) throws IOException;
}

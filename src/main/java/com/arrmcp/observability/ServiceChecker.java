package com.arrmcp.observability;

public interface ServiceChecker {

    String name();

    void check() throws Exception;
}

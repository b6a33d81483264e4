package com.agentvet.validation.reference;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HostClassifierTest {

    @Test
    void privateAndLoopbackLiterals() {
        assertTrue(HostClassifier.isPrivateAddress("10.0.0.1"));
        assertTrue(HostClassifier.isPrivateAddress("172.16.5.4"));
        assertTrue(HostClassifier.isPrivateAddress("192.168.1.10"));
        assertTrue(HostClassifier.isPrivateAddress("127.0.0.1"));
        assertTrue(HostClassifier.isPrivateAddress("169.254.169.254"));
        assertTrue(HostClassifier.isPrivateAddress("0.0.0.0"));
        assertTrue(HostClassifier.isPrivateAddress("[::1]"));
        assertTrue(HostClassifier.isPrivateAddress("[fd12:3456::1]"));
        assertTrue(HostClassifier.isPrivateAddress("[fe80::1%25eth0]"));
    }

    @Test
    void publicAddressesAndNamesAreNotPrivate() {
        assertFalse(HostClassifier.isPrivateAddress("8.8.8.8"));
        assertFalse(HostClassifier.isPrivateAddress("172.32.0.1"));
        assertFalse(HostClassifier.isPrivateAddress("[2001:db8::1]"));
        assertFalse(HostClassifier.isPrivateAddress("999.1.1.1"));
        assertFalse(HostClassifier.isPrivateAddress("internal.example.com"));
        assertFalse(HostClassifier.isPrivateAddress("localhost"));
    }

    @Test
    void localhostNames() {
        assertTrue(HostClassifier.isLocalhostName("localhost"));
        assertTrue(HostClassifier.isLocalhostName("LOCALHOST"));
        assertTrue(HostClassifier.isLocalhostName("api.localhost"));
        assertFalse(HostClassifier.isLocalhostName("localhost.example.com"));
    }

    @Test
    void suspiciousTlds() {
        List<String> tlds = List.of(".tk", ".zip");

        assertTrue(HostClassifier.hasSuspiciousTld("free-prizes.tk", tlds));
        assertTrue(HostClassifier.hasSuspiciousTld("files.ZIP.", tlds));
        assertFalse(HostClassifier.hasSuspiciousTld("example.com", tlds));
        assertFalse(HostClassifier.hasSuspiciousTld("tk.example.com", tlds));
    }
}

package com.dispatchqueue.client;

import java.io.IOException;

// Fires automations on a remote home automation server
public interface AutomationClient {

    void triggerAutomation(String automationId) throws IOException;
}

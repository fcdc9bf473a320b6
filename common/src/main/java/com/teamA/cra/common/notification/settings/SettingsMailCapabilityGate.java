package com.teamA.cra.common.notification.settings;

import com.teamA.cra.common.notification.DispatchOutcome;

public class SettingsMailCapabilityGate implements MailCapabilityGate {

    @Override
    public boolean isMailUsable(NotificationSettings settings) {
        return unusableReason(settings) == null;
    }

    @Override
    public String unusableReason(NotificationSettings settings) {
        if (settings == null || !settings.isEnabled()) return DispatchOutcome.DISABLED;
        if (!settings.isTransportConnected()) return DispatchOutcome.NOT_CONNECTED;
        return null;
    }
}

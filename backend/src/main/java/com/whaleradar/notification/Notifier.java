package com.whaleradar.notification;

import com.whaleradar.domain.Finding;
import com.whaleradar.domain.TradeCluster;

import java.util.List;
import java.util.Map;

/**
 * Outbound alert channel. Fire-and-forget: implementations never throw; a failed delivery
 * returns false and leaves any state the caller already persisted untouched.
 */
public interface Notifier {

    /**
     * @return true when the message was delivered
     */
    boolean notify(String address, List<Finding> findings, boolean elevated);

    boolean notifyCluster(TradeCluster cluster);

    /**
     * @param details ordered label/value pairs rendered one per line
     */
    boolean notifyStatus(StatusKind kind, Map<String, ?> details);
}

package com.conversio.service.core.funnel.storage;

import com.conversio.event.model.ActorEvent;
import java.util.List;

/** Storage contract: rows for the requested names and range, ordered by actor then timestamp. */
public interface FunnelEventSource {

    List<ActorEvent> fetch(FunnelEventQuery query);
}

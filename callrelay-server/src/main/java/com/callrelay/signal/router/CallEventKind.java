package com.callrelay.signal.router;

/**
 * Call lifecycle events, with the name a client sends and the name the peer receives.
 */
public enum CallEventKind {

    CALL("call", "incoming_call"),
    ACCEPT("accept_call", "call_accepted"),
    REJECT("reject_call", "call_rejected"),
    END("end_call", "end_call");

    private final String inboundName;
    private final String outboundName;

    CallEventKind(String inboundName, String outboundName) {
        this.inboundName = inboundName;
        this.outboundName = outboundName;
    }

    public String getInboundName() {
        return inboundName;
    }

    public String getOutboundName() {
        return outboundName;
    }
}

package com.callrelay.signal.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.callrelay.signal.dto.RtcTokenResponse;
import com.callrelay.signal.exception.InvalidRequestException;
import com.callrelay.signal.token.RtcCredential;
import com.callrelay.signal.token.RtcTokenService;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
public class RtcTokenController {

    private final RtcTokenService rtcTokenService;

    /**
     * GET /rtcToken?channelName=...&uid=12345
     * Returns a short-lived publisher token bound to a numeric uid.
     */
    @GetMapping("/rtcToken")
    public RtcTokenResponse rtcToken(
            @RequestParam(name = "channelName", required = false) String channelName,
            @RequestParam(name = "uid", required = false) String uid
    ) {
        if (channelName == null || channelName.isEmpty() || uid == null || uid.isEmpty()) {
            throw new InvalidRequestException("channelName and uid required");
        }
        long uidValue = rtcTokenService.parseUid(uid);
        RtcCredential credential = rtcTokenService.issuePublisher(channelName, uidValue);
        return new RtcTokenResponse(credential.token(), credential.uid(), credential.channelName());
    }
}

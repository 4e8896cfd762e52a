package com.example.offlinecache.api;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.router.RequestRouter;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Adapter for hosts that forward their outgoing requests over HTTP. The envelope's own status
 * carries the outcome; the HTTP exchange itself always succeeds.
 */
@RestController
public class InterceptController {

    private final RequestRouter router;

    public InterceptController(RequestRouter router) {
        this.router = router;
    }

    @PostMapping("/intercept")
    public NetResponse intercept(@RequestBody NetRequest request) {
        return router.handle(request);
    }
}

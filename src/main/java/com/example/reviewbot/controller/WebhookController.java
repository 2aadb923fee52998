package com.example.reviewbot.controller;

import com.example.reviewbot.router.BotReply;
import com.example.reviewbot.router.EventRouter;
import com.example.reviewbot.router.InboundEvent;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class WebhookController {

    private final EventRouter eventRouter;

    public WebhookController(EventRouter eventRouter) {
        this.eventRouter = eventRouter;
    }

    /** Store calls block, so routing runs off the event loop. */
    @PostMapping(value = "/webhook", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<BotReply> receive(@RequestBody InboundEvent event) {
        return Mono.fromCallable(() -> eventRouter.handle(event))
                .subscribeOn(Schedulers.boundedElastic());
    }
}

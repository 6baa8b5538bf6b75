package com.autodev.coordinator.api;

import com.autodev.coordinator.api.dto.DiscussionPostResponse;
import com.autodev.coordinator.api.dto.LockResponse;
import com.autodev.coordinator.api.dto.MessageResponse;
import com.autodev.coordinator.api.dto.ProposalResponse;
import com.autodev.coordinator.model.Proposal;
import com.autodev.coordinator.model.ProposalStatus;
import com.autodev.coordinator.service.AgentRegistryService;
import com.autodev.coordinator.service.AgentView;
import com.autodev.coordinator.service.DiscussionService;
import com.autodev.coordinator.service.LockService;
import com.autodev.coordinator.service.MailboxService;
import com.autodev.coordinator.service.ProposalService;
import com.autodev.coordinator.service.ProviderHealthService;
import com.autodev.coordinator.service.ProviderStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Read-only projections of the worker-to-worker tables, plus two operator
 * actions: clearing a stale provider limit and marking an approved
 * proposal implemented.
 */
@RestController
public class CoordinationController {

    private final LockService           locks;
    private final MailboxService        mailbox;
    private final DiscussionService     discussion;
    private final ProposalService       proposals;
    private final ProviderHealthService providers;
    private final AgentRegistryService  agents;

    public CoordinationController(LockService locks,
                                  MailboxService mailbox,
                                  DiscussionService discussion,
                                  ProposalService proposals,
                                  ProviderHealthService providers,
                                  AgentRegistryService agents) {
        this.locks      = locks;
        this.mailbox    = mailbox;
        this.discussion = discussion;
        this.proposals  = proposals;
        this.providers  = providers;
        this.agents     = agents;
    }

    @GetMapping("/agents")
    public List<AgentView> agents() {
        return agents.all();
    }

    @GetMapping("/agents/{workerId}")
    public AgentView agent(@PathVariable String workerId) {
        return agents.get(workerId);
    }

    @GetMapping("/locks")
    public List<LockResponse> locks(@RequestParam(required = false) String holder) {
        return locks.active(holder).stream().map(LockResponse::from).toList();
    }

    @GetMapping("/messages")
    public List<MessageResponse> messages(@RequestParam(required = false) String worker,
                                          @RequestParam(defaultValue = "100") int limit) {
        return mailbox.recent(worker, limit).stream().map(MessageResponse::from).toList();
    }

    @GetMapping("/discussions")
    public List<DiscussionPostResponse> discussions(@RequestParam(required = false) String topic,
                                                    @RequestParam(defaultValue = "100") int limit) {
        return discussion.list(topic, null, limit).stream().map(DiscussionPostResponse::from).toList();
    }

    @GetMapping("/discussions/{id}/thread")
    public List<DiscussionPostResponse> thread(@PathVariable UUID id) {
        return discussion.thread(id).stream().map(DiscussionPostResponse::from).toList();
    }

    @GetMapping("/proposals")
    public List<ProposalResponse> proposals(@RequestParam(required = false) ProposalStatus status) {
        return proposals.list(status).stream()
                .map(p -> ProposalResponse.from(p, proposals.tally(p.getId()), List.of()))
                .toList();
    }

    /** Approved proposals still to be carried out; all=true adds the implemented ones. */
    @GetMapping("/proposals/approved")
    public List<ProposalResponse> approvedProposals(@RequestParam(defaultValue = "false") boolean all) {
        return proposals.approved(!all).stream()
                .map(p -> ProposalResponse.from(p, proposals.tally(p.getId()), List.of()))
                .toList();
    }

    @GetMapping("/proposals/{id}")
    public ProposalResponse proposal(@PathVariable UUID id) {
        Proposal p = proposals.get(id);
        return ProposalResponse.from(p, proposals.tally(id), proposals.votes(id));
    }

    @PostMapping("/proposals/{id}/implemented")
    public ProposalResponse markImplemented(@PathVariable UUID id,
                                            @RequestParam(defaultValue = "human") String by) {
        Proposal p = proposals.markImplemented(id, by);
        return ProposalResponse.from(p, proposals.tally(id), proposals.votes(id));
    }

    @GetMapping("/providers")
    public List<ProviderStatus> providers() {
        return providers.all();
    }

    @PostMapping("/providers/{provider}/clear")
    public ProviderStatus clearProvider(@PathVariable String provider,
                                        @RequestParam(defaultValue = "human") String by) {
        return providers.clear(provider, by);
    }
}

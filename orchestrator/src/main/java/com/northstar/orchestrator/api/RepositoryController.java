package com.northstar.orchestrator.api;

import com.northstar.orchestrator.api.dto.ConnectRepositoryRequest;
import com.northstar.orchestrator.api.dto.RepositoryResponse;
import com.northstar.orchestrator.service.RepositoryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for connected repositories.
 *
 * POST /repositories                           connect (or update) a repository
 * POST /repositories/{owner}/{name}/activate   make it the user's active one
 * GET  /repositories?userId=...                list a user's repositories
 * GET  /repositories/active?userId=...         the user's active repository
 */
@RestController
@RequestMapping("/repositories")
public class RepositoryController {

    private final RepositoryService repositoryService;

    public RepositoryController(RepositoryService repositoryService) {
        this.repositoryService = repositoryService;
    }

    @PostMapping
    public ResponseEntity<RepositoryResponse> connect(@RequestBody ConnectRepositoryRequest req) {
        var repo = repositoryService.connect(req.repoFullname(), req.defaultBranch(), req.baseBranch(), req.userId());
        return ResponseEntity.status(HttpStatus.CREATED).body(RepositoryResponse.from(repo));
    }

    @PostMapping("/{owner}/{name}/activate")
    public RepositoryResponse activate(@PathVariable String owner, @PathVariable String name) {
        return RepositoryResponse.from(repositoryService.activate(owner + "/" + name));
    }

    @GetMapping("/active")
    public RepositoryResponse active(@RequestParam String userId) {
        return repositoryService.findActive(userId)
                .map(RepositoryResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No active repository for user: " + userId));
    }

    @GetMapping
    public List<RepositoryResponse> list(@RequestParam String userId) {
        return repositoryService.list(userId).stream()
                .map(RepositoryResponse::from)
                .toList();
    }
}

package com.delta.adsync.sync.api;

import com.delta.adsync.sync.model.AdAccount;
import com.delta.adsync.sync.model.PlatformConnection;
import com.delta.adsync.sync.service.ConnectionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/connections")
public class ConnectionController {
    private final ConnectionService connectionService;

    public ConnectionController(ConnectionService connectionService) {
        this.connectionService = connectionService;
    }

    @PostMapping
    public ResponseEntity<PlatformConnection> register(@RequestBody ConnectionApiRequest request) {
        boolean makeDefault = Boolean.TRUE.equals(request.makeDefault());
        PlatformConnection connection;
        if (request.code() != null && !request.code().isBlank()) {
            connection = connectionService.connectWithCode(
                request.tenantId(),
                request.code(),
                request.redirectUri(),
                makeDefault
            );
        } else if (request.accessToken() != null && !request.accessToken().isBlank()) {
            connection = connectionService.registerConnection(
                request.tenantId(),
                request.accessToken(),
                request.tokenExpiresAt(),
                Boolean.TRUE.equals(request.longLivedToken()),
                makeDefault
            );
        } else {
            throw new ResponseStatusException(BAD_REQUEST, "Either code or accessToken is required");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(connection);
    }

    @GetMapping
    public List<PlatformConnection> list(@RequestParam(name = "tenantId") String tenantId) {
        return connectionService.findConnections(tenantId);
    }

    @GetMapping("/{connectionId}")
    public PlatformConnection get(@PathVariable("connectionId") long connectionId) {
        PlatformConnection connection = connectionService.findConnection(connectionId);
        if (connection == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown connection " + connectionId);
        }
        return connection;
    }

    @PostMapping("/{connectionId}/default")
    public PlatformConnection makeDefault(@PathVariable("connectionId") long connectionId) {
        connectionService.makeDefault(connectionId);
        return connectionService.findConnection(connectionId);
    }

    @PostMapping("/{connectionId}/refresh")
    public PlatformConnection refresh(@PathVariable("connectionId") long connectionId) {
        return connectionService.refreshConnectionToken(connectionId);
    }

    @PostMapping("/{connectionId}/accounts")
    public AdAccount bindAccount(
        @PathVariable("connectionId") long connectionId,
        @RequestBody AccountBindingApiRequest request
    ) {
        return connectionService.bindAccount(
            request.tenantId(),
            connectionId,
            request.accountId(),
            request.name(),
            request.currency(),
            request.timezoneName(),
            request.accountStatus(),
            Boolean.TRUE.equals(request.rebind())
        );
    }

    @PostMapping("/{connectionId}/accounts/discover")
    public List<AdAccount> discoverAccounts(@PathVariable("connectionId") long connectionId) {
        return connectionService.discoverAccounts(connectionId);
    }

    @DeleteMapping("/{connectionId}/accounts/{accountId}")
    public AdAccount unbindAccount(
        @PathVariable("connectionId") long connectionId,
        @PathVariable("accountId") String accountId,
        @RequestParam(name = "tenantId") String tenantId
    ) {
        return connectionService.unbindAccount(tenantId, connectionId, accountId);
    }

    @GetMapping("/accounts")
    public List<AdAccount> accounts(@RequestParam(name = "tenantId") String tenantId) {
        return connectionService.findAccounts(tenantId);
    }

    @DeleteMapping("/{connectionId}")
    public ResponseEntity<Void> delete(@PathVariable("connectionId") long connectionId) {
        connectionService.deleteConnection(connectionId);
        return ResponseEntity.noContent().build();
    }
}

package io.facetrelay.runtime;

import io.facetrelay.codec.CallData;
import io.facetrelay.codec.MessageCodec;
import io.facetrelay.config.FacetRelayConfig;
import io.facetrelay.config.RelaySettings;
import io.facetrelay.error.RelayError;
import io.facetrelay.error.RelayException;
import io.facetrelay.facet.DispatchResult;
import io.facetrelay.facet.DispatchTable;
import io.facetrelay.facet.Facet;
import io.facetrelay.facet.FacetCall;
import io.facetrelay.facet.FacetCutAction;
import io.facetrelay.facet.FacetServices;
import io.facetrelay.facet.NftBridgeFacet;
import io.facetrelay.facet.NftFacet;
import io.facetrelay.model.ChainSelectors;
import io.facetrelay.model.FailedMessage;
import io.facetrelay.model.InboundMessage;
import io.facetrelay.model.MessageErrorCode;
import io.facetrelay.model.OutboundMessage;
import io.facetrelay.model.ReceiveStatus;
import io.facetrelay.observability.AuditLogger;
import io.facetrelay.observability.PrometheusFormatter;
import io.facetrelay.observability.TraceContextUtil;
import io.facetrelay.router.FeeWallet;
import io.facetrelay.router.FileRelayRouter;
import io.facetrelay.router.RelayRouter;
import io.facetrelay.storage.AllowlistStore;
import io.facetrelay.storage.Database;
import io.facetrelay.storage.FailureLedger;
import io.facetrelay.storage.RoleStore;
import io.facetrelay.storage.UnitStateStore;
import io.facetrelay.storage.WalletStore;
import io.facetrelay.util.Addresses;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

public final class FacetRelayRuntime {
    private static final String SYSTEM_ACTOR = "system";

    private final FacetRelayConfig config;
    private final Database database;
    private final AllowlistStore allowlist;
    private final FailureLedger ledger;
    private final RoleStore roles;
    private final UnitStateStore unitState;
    private final WalletStore wallet;
    private final DispatchTable dispatchTable;
    private final AuditLogger auditLogger;
    private final RelayRouter injectedRouter;
    private final FacetServices services;
    private final AtomicLong sentTotal = new AtomicLong(0L);
    private final AtomicLong receivedTotal = new AtomicLong(0L);
    private final AtomicLong appliedTotal = new AtomicLong(0L);
    private final AtomicLong failedTotal = new AtomicLong(0L);
    private final AtomicLong recoveredTotal = new AtomicLong(0L);
    private final AtomicLong retryFailedTotal = new AtomicLong(0L);
    private final AtomicLong rejectedTotal = new AtomicLong(0L);
    private volatile RelaySettings settings;
    private volatile MessageCodec codec;
    private volatile RelayRouter router;
    // Guarded by this; only the dispatching thread can observe a non-zero depth.
    private int dispatchDepth;

    public FacetRelayRuntime(FacetRelayConfig config) {
        this(config, null);
    }

    /**
     * @param router relay to send through; {@code null} builds a {@link FileRelayRouter} from settings
     */
    public FacetRelayRuntime(FacetRelayConfig config, RelayRouter router) {
        this.config = config;
        this.database = new Database(config);
        this.allowlist = new AllowlistStore(database);
        this.ledger = new FailureLedger(database);
        this.roles = new RoleStore(database);
        this.unitState = new UnitStateStore(database);
        this.wallet = new WalletStore(database);
        this.dispatchTable = new DispatchTable();
        String auditSigningSecret = loadOrCreateAuditSigningSecret(config.securityRoot().resolve("audit-signing.key"));
        this.auditLogger = new AuditLogger(config.auditRoot().resolve("audit.log"), config.namespace(), auditSigningSecret);
        this.injectedRouter = router;
        this.services = new UnitServices();
        this.settings = RelaySettings.defaults(config);
        this.codec = new MessageCodec(settings.gasLimit(), settings.maxPayloadBytes());
        this.router = router != null ? router : buildFileRouter(settings, codec);
        registerDefaultFacets();
    }

    public void init() {
        database.init();
        loadSettings();
        database.inTransaction(c -> {
            for (Facet facet : dispatchTable.facets()) {
                facet.initSchema(c);
            }
            return null;
        });
    }

    public SettingsReloadOutcome reloadSettings() {
        return loadSettings();
    }

    public RelaySettings settings() {
        return settings;
    }

    public String unitAddress() {
        return settings.unitAddress();
    }

    public FeeWallet wallet() {
        return wallet;
    }

    public RelayRouter router() {
        return router;
    }

    public synchronized InitializeOutcome initialize(
            String caller,
            String name,
            String symbol,
            String baseUri,
            String routerAddress,
            String feeToken
    ) {
        String admin = Addresses.normalize(caller);
        String registeredRouter = routerAddress == null || routerAddress.isBlank()
                ? settings.routerAddress()
                : Addresses.normalize(routerAddress);
        String resolvedFeeToken = feeToken == null || feeToken.isBlank() ? Addresses.ZERO : Addresses.normalize(feeToken);
        String traceId = TraceContextUtil.newTraceId();
        long now = Instant.now().toEpochMilli();
        database.inTransaction(c -> {
            if (!unitState.putIfAbsent(UnitStateStore.KEY_INITIALIZED, "true", now)) {
                throw RelayException.of(RelayError.ALREADY_INITIALIZED, "unit " + unitAddress() + " is already initialized");
            }
            unitState.put(UnitStateStore.KEY_ROUTER, registeredRouter, now);
            unitState.put(UnitStateStore.KEY_FEE_TOKEN, resolvedFeeToken, now);
            unitState.put(UnitStateStore.KEY_NAME, name == null ? "" : name, now);
            unitState.put(UnitStateStore.KEY_SYMBOL, symbol == null ? "" : symbol, now);
            unitState.put(UnitStateStore.KEY_BASE_URI, baseUri == null ? "" : baseUri, now);
            roles.grantRole(RoleStore.ADMIN_ROLE, admin, admin, now);
            return null;
        });
        auditLogger.log(AuditLogger.AuditEvent.of(
                "unit.initialize",
                admin,
                "unit/" + unitAddress(),
                "ok",
                traceId,
                null,
                Map.of("router", registeredRouter, "fee_token", resolvedFeeToken, "name", name == null ? "" : name)
        ));
        return new InitializeOutcome(unitAddress(), admin, registeredRouter, resolvedFeeToken);
    }

    public boolean isInitialized() {
        return unitState.get(UnitStateStore.KEY_INITIALIZED).isPresent();
    }

    public Optional<String> registeredRouter() {
        return unitState.get(UnitStateStore.KEY_ROUTER);
    }

    public synchronized RouterUpdateOutcome setRouter(String caller, String routerAddress) {
        requireAdmin(caller);
        String next = Addresses.normalize(routerAddress);
        String previous = registeredRouter().orElse("");
        unitState.put(UnitStateStore.KEY_ROUTER, next, Instant.now().toEpochMilli());
        boolean changed = !previous.equals(next);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "router.update",
                Addresses.normalize(caller),
                "unit/" + unitAddress() + "/router",
                changed ? "updated" : "unchanged",
                TraceContextUtil.newTraceId(),
                null,
                Map.of("previous", previous, "current", next)
        ));
        return new RouterUpdateOutcome(previous, next, changed);
    }

    public synchronized RoleUpdateOutcome grantRole(String caller, String role, String account) {
        requireAdmin(caller);
        boolean changed = roles.grantRole(role, Addresses.normalize(account), Addresses.normalize(caller),
                Instant.now().toEpochMilli());
        auditRole("role.grant", caller, role, account, changed);
        return new RoleUpdateOutcome(role, Addresses.normalize(account), true, changed);
    }

    public synchronized RoleUpdateOutcome revokeRole(String caller, String role, String account) {
        requireAdmin(caller);
        boolean changed = roles.revokeRole(role, Addresses.normalize(account));
        auditRole("role.revoke", caller, role, account, changed);
        return new RoleUpdateOutcome(role, Addresses.normalize(account), false, changed);
    }

    public boolean hasRole(String role, String account) {
        return roles.hasRole(role, Addresses.normalize(account));
    }

    public synchronized AllowlistUpdateOutcome setDestinationAllowed(String caller, long chainSelector, boolean allowed) {
        requireAdmin(caller);
        boolean changed = allowlist.setDestinationAllowed(chainSelector, allowed, Addresses.normalize(caller),
                Instant.now().toEpochMilli());
        return auditAllowlist(caller, "destination", chainSelector, null, allowed, changed);
    }

    public synchronized AllowlistUpdateOutcome setSourceAllowed(String caller, long chainSelector, boolean allowed) {
        requireAdmin(caller);
        boolean changed = allowlist.setSourceAllowed(chainSelector, allowed, Addresses.normalize(caller),
                Instant.now().toEpochMilli());
        return auditAllowlist(caller, "source", chainSelector, null, allowed, changed);
    }

    public synchronized AllowlistUpdateOutcome setSenderAllowed(String caller, long sourceChainSelector, String sender,
                                                                boolean allowed) {
        requireAdmin(caller);
        boolean changed = allowlist.setSenderAllowed(sourceChainSelector, sender, allowed, Addresses.normalize(caller),
                Instant.now().toEpochMilli());
        return auditAllowlist(caller, "sender", sourceChainSelector, Addresses.normalize(sender), allowed, changed);
    }

    public boolean isDestinationAllowed(long chainSelector) {
        return allowlist.isDestinationAllowed(chainSelector);
    }

    public boolean isSourceAllowed(long chainSelector) {
        return allowlist.isSourceAllowed(chainSelector);
    }

    public boolean isSenderAllowed(long sourceChainSelector, String sender) {
        return allowlist.isSenderAllowed(sourceChainSelector, sender);
    }

    public AllowlistView allowlist() {
        List<String> destinations = new ArrayList<>();
        for (Long chain : allowlist.allowedDestinations()) {
            destinations.add(ChainSelectors.format(chain));
        }
        List<String> sources = new ArrayList<>();
        for (Long chain : allowlist.allowedSources()) {
            sources.add(ChainSelectors.format(chain));
        }
        List<String> senders = new ArrayList<>();
        for (AllowlistStore.AllowedSender sender : allowlist.allowedSenders()) {
            senders.add(ChainSelectors.format(sender.chainSelector()) + ":" + sender.sender());
        }
        return new AllowlistView(destinations, sources, senders);
    }

    public synchronized FundOutcome fund(String asset, BigInteger amount) {
        String normalized = Addresses.normalize(asset);
        wallet.credit(normalized, amount);
        BigInteger balance = wallet.balanceOf(normalized);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "wallet.fund",
                SYSTEM_ACTOR,
                "unit/" + unitAddress() + "/wallet",
                "ok",
                TraceContextUtil.newTraceId(),
                null,
                Map.of("asset", normalized, "amount", amount.toString(), "balance", balance.toString())
        ));
        return new FundOutcome(normalized, amount.toString(), balance.toString());
    }

    public BigInteger quoteFee(long destinationChainSelector, String receiver, byte[] data, String token,
                               BigInteger amount, String feeToken) {
        OutboundMessage message = codec.encode(receiver, data, tokenOrNative(token), amount, resolveFeeToken(feeToken));
        return router.getFee(destinationChainSelector, message);
    }

    public synchronized SendOutcome sendText(String caller, long destinationChainSelector, String receiver, String text,
                                             String token, BigInteger amount, String feeToken) {
        byte[] data = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
        return send(caller, destinationChainSelector, receiver, data, token, amount, feeToken);
    }

    /**
     * Builds a message and submits it through the relay, paying the fee from the unit wallet.
     * The fee debit and the submission commit together; on any failure the wallet is unchanged.
     */
    public synchronized SendOutcome send(String caller, long destinationChainSelector, String receiver, byte[] data,
                                         String token, BigInteger amount, String feeToken) {
        String traceId = TraceContextUtil.newTraceId();
        try {
            return database.inTransaction(c ->
                    submit(caller, destinationChainSelector, receiver, data, token, amount, feeToken, traceId));
        } catch (RelayException e) {
            rejectedTotal.incrementAndGet();
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "message.sent",
                    Addresses.isValid(caller) ? Addresses.normalize(caller) : String.valueOf(caller),
                    "chain/" + ChainSelectors.format(destinationChainSelector),
                    "rejected",
                    traceId,
                    null,
                    Map.of("error", e.error().wireName(), "reason", e.getMessage())
            ));
            throw e;
        }
    }

    private SendOutcome submit(String caller, long destinationChainSelector, String receiver, byte[] data,
                               String token, BigInteger amount, String feeToken, String traceId) {
        if (!isInitialized()) {
            throw RelayException.of(RelayError.NOT_INITIALIZED, "unit " + unitAddress() + " is not initialized");
        }
        if (!allowlist.isDestinationAllowed(destinationChainSelector)) {
            throw RelayException.of(RelayError.DESTINATION_CHAIN_NOT_ALLOWLISTED,
                    "destination chain " + ChainSelectors.format(destinationChainSelector) + " is not allowlisted");
        }
        String resolvedFeeToken = resolveFeeToken(feeToken);
        OutboundMessage message = codec.encode(receiver, data, tokenOrNative(token), amount, resolvedFeeToken);
        RelayRouter relay = router;
        BigInteger fee = relay.getFee(destinationChainSelector, message);
        BigInteger nativeValue = BigInteger.ZERO;
        BigInteger balance = wallet.balanceOf(resolvedFeeToken);
        if (balance.compareTo(fee) < 0) {
            throw RelayException.of(RelayError.INSUFFICIENT_BALANCE,
                    "balance " + balance + " of " + resolvedFeeToken + " < fee " + fee);
        }
        if (Addresses.isZero(resolvedFeeToken)) {
            nativeValue = fee;
        } else {
            // Exact approval; the router pulls all of it, a rollback withdraws it.
            wallet.approve(resolvedFeeToken, relay.address(), fee);
        }
        String messageId;
        try {
            messageId = relay.send(settings.chainSelector(), destinationChainSelector, unitAddress(), message,
                    wallet, nativeValue);
        } catch (RelayException e) {
            if (e.error() == RelayError.INSUFFICIENT_BALANCE || e.error() == RelayError.RELAY_SUBMISSION_FAILED) {
                throw e;
            }
            throw new RelayException(RelayError.RELAY_SUBMISSION_FAILED, "relay rejected message: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new RelayException(RelayError.RELAY_SUBMISSION_FAILED, "relay submission failed: " + e.getMessage(), e);
        }
        String actor = Addresses.normalize(caller);
        String tokenAddress = tokenOrNative(token);
        String amountText = amount == null ? "0" : amount.toString();
        database.afterCompletion(() -> {
            sentTotal.incrementAndGet();
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "message.sent",
                    actor,
                    "chain/" + ChainSelectors.format(destinationChainSelector),
                    "ok",
                    traceId,
                    messageId,
                    Map.of(
                            "destination_chain", ChainSelectors.format(destinationChainSelector),
                            "receiver", Addresses.normalize(receiver),
                            "token", tokenAddress,
                            "amount", amountText,
                            "fee_token", resolvedFeeToken,
                            "fee", fee.toString()
                    )
            ));
        }, () -> {
        });
        return new SendOutcome(messageId, ChainSelectors.format(destinationChainSelector), Addresses.normalize(receiver),
                resolvedFeeToken, fee.toString(), traceId);
    }

    public synchronized ReceiveOutcome receiveWire(String caller, byte[] wire) {
        guardReentry();
        String traceId = TraceContextUtil.newTraceId();
        try {
            requireRouter(caller);
            return accept(caller, codec.decode(wire), traceId);
        } catch (RelayException e) {
            auditRejection(caller, null, e, traceId);
            throw e;
        }
    }

    /**
     * Receive callback. Only the registered router may call it; source chain and sender are
     * checked before the payload is dispatched to the unit itself.
     */
    public synchronized ReceiveOutcome ccipReceive(String caller, InboundMessage message) {
        guardReentry();
        String traceId = TraceContextUtil.newTraceId();
        try {
            requireRouter(caller);
            return accept(caller, message, traceId);
        } catch (RelayException e) {
            auditRejection(caller, message == null ? null : message.messageId(), e, traceId);
            throw e;
        }
    }

    private ReceiveOutcome accept(String caller, InboundMessage message, String traceId) {
        if (!allowlist.isSourceAllowed(message.sourceChainSelector())) {
            throw RelayException.of(RelayError.SOURCE_CHAIN_NOT_ALLOWED,
                    "source chain " + ChainSelectors.format(message.sourceChainSelector()) + " is not allowed");
        }
        if (!allowlist.isSenderAllowed(message.sourceChainSelector(), message.sender())) {
            throw RelayException.of(RelayError.SENDER_NOT_ALLOWED,
                    "sender " + message.sender() + " is not allowed from chain "
                            + ChainSelectors.format(message.sourceChainSelector()));
        }
        receivedTotal.incrementAndGet();
        String messageId = message.messageId();
        DispatchResult result = dispatch(message.data(), traceId, () -> {
            // A redelivered message that now applies clears its pending record with it.
            if (ledger.contains(messageId)) {
                ledger.resolve(messageId, Addresses.normalize(caller), Instant.now().toEpochMilli());
            }
        });
        // The outcome is final from here on; later side effects must not turn it into an error.
        if (result.success()) {
            appliedTotal.incrementAndGet();
            auditAfterOutcome(AuditLogger.AuditEvent.of(
                    "message.received",
                    Addresses.normalize(caller),
                    "chain/" + ChainSelectors.format(message.sourceChainSelector()),
                    "applied",
                    traceId,
                    messageId,
                    Map.of("sender", message.sender(), "output", result.output() == null ? "" : result.output())
            ));
            return new ReceiveOutcome(messageId, ReceiveStatus.APPLIED, "", traceId);
        }
        failedTotal.incrementAndGet();
        ledger.recordFailure(message, result.error(), Instant.now().toEpochMilli());
        auditAfterOutcome(AuditLogger.AuditEvent.of(
                "message.failed",
                Addresses.normalize(caller),
                "chain/" + ChainSelectors.format(message.sourceChainSelector()),
                "failed",
                traceId,
                messageId,
                Map.of("sender", message.sender(), "reason", result.error())
        ));
        return new ReceiveOutcome(messageId, ReceiveStatus.FAILED, result.error(), traceId);
    }

    /**
     * Re-applies a failed message with {@code data}, or with its persisted payload when
     * {@code data} is {@code null}. Allowlists are not consulted again.
     */
    public synchronized RetryOutcome retryFailedMessage(String caller, String messageId, byte[] data) {
        guardReentry();
        if (settings.retryRequiresAdmin()) {
            requireAdmin(caller);
        }
        String actor = Addresses.normalize(caller);
        FailedMessage record = ledger.get(messageId)
                .orElseThrow(() -> RelayException.of(RelayError.MESSAGE_NOT_FAILED,
                        "no failed message with id " + messageId));
        String traceId = TraceContextUtil.newTraceId();
        byte[] payload = data == null ? record.data() : data;
        DispatchResult result = dispatch(payload, traceId,
                () -> ledger.resolve(messageId, actor, Instant.now().toEpochMilli()));
        if (result.success()) {
            recoveredTotal.incrementAndGet();
            auditAfterOutcome(AuditLogger.AuditEvent.of(
                    "message.recovered",
                    actor,
                    "chain/" + ChainSelectors.format(record.sourceChainSelector()),
                    "recovered",
                    traceId,
                    messageId,
                    Map.of("attempts", record.attempts(), "replaced_payload", data != null)
            ));
            return new RetryOutcome(messageId, true, record.attempts(), "", traceId);
        }
        retryFailedTotal.incrementAndGet();
        ledger.recordRetryFailure(messageId, result.error(), Instant.now().toEpochMilli());
        auditAfterOutcome(AuditLogger.AuditEvent.of(
                "message.recovered",
                actor,
                "chain/" + ChainSelectors.format(record.sourceChainSelector()),
                "failed",
                traceId,
                messageId,
                Map.of("attempts", record.attempts() + 1, "reason", result.error())
        ));
        return new RetryOutcome(messageId, false, record.attempts() + 1, result.error(), traceId);
    }

    public List<FailedMessageView> failedMessages(int offset, int limit) {
        List<FailedMessageView> out = new ArrayList<>();
        for (FailedMessage message : ledger.list(offset, limit)) {
            out.add(FailedMessageView.of(message));
        }
        return out;
    }

    public Optional<FailedMessageView> failedMessage(String messageId) {
        return ledger.get(messageId).map(FailedMessageView::of);
    }

    public MessageErrorCode errorCodeOf(String messageId) {
        return ledger.contains(messageId) ? MessageErrorCode.BASIC : MessageErrorCode.RESOLVED;
    }

    /**
     * External entry point of the unit: routes {@code callData} by selector with the caller's
     * identity. Facet failures propagate and roll the call back.
     */
    public synchronized CallOutcome call(String caller, byte[] callData) {
        guardReentry();
        String actor = Addresses.normalize(caller);
        CallData.Call decoded = CallData.decode(callData);
        DispatchTable.Route route = dispatchTable.find(decoded.selector())
                .orElseThrow(() -> RelayException.of(RelayError.UNKNOWN_SELECTOR,
                        "no facet serves selector " + decoded.selector()));
        String traceId = TraceContextUtil.newTraceId();
        DispatchResult result;
        dispatchDepth++;
        try {
            result = database.inTransaction(
                    c -> route.facet().invoke(facetCall(route, decoded, actor, c, traceId)),
                    DispatchResult::success
            );
        } catch (RelayException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RelayException(RelayError.FACET_CALL_FAILED, failureReason(e), e);
        } finally {
            dispatchDepth--;
        }
        if (!result.success()) {
            throw RelayException.of(RelayError.FACET_CALL_FAILED, route.signature() + ": " + result.error());
        }
        return new CallOutcome(route.facet().id(), route.signature(), result.output(), traceId);
    }

    public synchronized FacetCutOutcome cutFacet(String caller, FacetCutAction action, Facet facet) {
        requireAdmin(caller);
        List<String> selectors = dispatchTable.cut(action, facet);
        if (action != FacetCutAction.REMOVE) {
            database.inTransaction(c -> {
                facet.initSchema(c);
                return null;
            });
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "facet.cut",
                Addresses.normalize(caller),
                "unit/" + unitAddress() + "/facets",
                "ok",
                TraceContextUtil.newTraceId(),
                null,
                Map.of("action", action.name(), "facet", facet.id(), "selectors", selectors)
        ));
        return new FacetCutOutcome(action.name(), facet.id(), selectors);
    }

    public List<FacetRouteView> facets() {
        List<FacetRouteView> out = new ArrayList<>();
        for (DispatchTable.Route route : dispatchTable.routes()) {
            out.add(new FacetRouteView(route.selector(), route.signature(), route.facet().id()));
        }
        return out;
    }

    /**
     * Pulls pending messages addressed to this unit's chain from the file relay.
     */
    public FileRelayRouter.DeliverySummary deliverPending(int maxMessages) {
        if (!(router instanceof FileRelayRouter)) {
            throw new IllegalStateException("Configured router does not spool messages: " + router.getClass().getName());
        }
        FileRelayRouter fileRouter = (FileRelayRouter) router;
        return fileRouter.deliver(settings.chainSelector(), (caller, wire) -> receiveWire(caller, wire).status(),
                maxMessages);
    }

    public StatsOutcome stats() {
        RelaySettings current = settings;
        return new StatsOutcome(
                config.namespace(),
                current.unitAddress(),
                ChainSelectors.format(current.chainSelector()),
                router.address(),
                registeredRouter().orElse(""),
                isInitialized(),
                sentTotal.get(),
                receivedTotal.get(),
                appliedTotal.get(),
                failedTotal.get(),
                recoveredTotal.get(),
                retryFailedTotal.get(),
                rejectedTotal.get(),
                database.completionFailures(),
                database.lastCompletionFailure(),
                ledger.count(),
                ledger.recoveredCount(),
                allowlist.allowedDestinations().size(),
                allowlist.allowedSources().size(),
                allowlist.allowedSenders().size(),
                dispatchTable.facets().size(),
                dispatchTable.selectors().size(),
                wallet.balanceOf(FeeWallet.NATIVE).toString()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats(), config.namespace());
    }

    public AuditLogger.IntegrityReport verifyAuditIntegrity() {
        AuditLogger.IntegrityReport report = auditLogger.verify();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "audit.verify",
                SYSTEM_ACTOR,
                "runtime/audit",
                report.ok() ? "ok" : "failed",
                null,
                null,
                Map.of("checked_rows", report.checkedRows(), "broken_line", report.brokenLine(), "reason", report.reason())
        ));
        return report;
    }

    public List<String> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    /**
     * Runs one self-dispatch of {@code payload} as the unit in its own transaction.
     * {@code onSuccess} runs inside that transaction and commits with the facet's writes.
     * Every failure is returned, never thrown.
     */
    private DispatchResult dispatch(byte[] payload, String traceId, Runnable onSuccess) {
        dispatchDepth++;
        try {
            return database.inTransaction(c -> {
                DispatchResult result = invokeSelf(c, payload, traceId);
                if (result.success()) {
                    onSuccess.run();
                }
                return result;
            }, DispatchResult::success);
        } catch (RuntimeException e) {
            return DispatchResult.fail(failureReason(e));
        } finally {
            dispatchDepth--;
        }
    }

    private DispatchResult invokeSelf(Connection c, byte[] payload, String traceId) throws Exception {
        CallData.Call decoded = CallData.decode(payload);
        Optional<DispatchTable.Route> route = dispatchTable.find(decoded.selector());
        if (route.isEmpty()) {
            return DispatchResult.fail(RelayError.UNKNOWN_SELECTOR.wireName() + ": no facet serves selector "
                    + decoded.selector());
        }
        return route.get().facet().invoke(facetCall(route.get(), decoded, unitAddress(), c, traceId));
    }

    private FacetCall facetCall(DispatchTable.Route route, CallData.Call decoded, String caller, Connection c,
                                String traceId) {
        return new FacetCall(route.signature(), decoded, caller, unitAddress(), c, services, traceId);
    }

    private String failureReason(Throwable error) {
        Throwable root = error;
        while (!(root instanceof RelayException) && root.getCause() != null) {
            root = root.getCause();
        }
        if (root instanceof RelayException) {
            return root.getMessage();
        }
        String message = root.getMessage();
        return root.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }

    private void guardReentry() {
        if (dispatchDepth > 0) {
            throw RelayException.of(RelayError.REENTRANT_CALL, "unit " + unitAddress() + " is already dispatching");
        }
    }

    private void requireRouter(String caller) {
        String registered = registeredRouter().orElse("");
        if (registered.isEmpty() || caller == null || !Addresses.isValid(caller) || !Addresses.same(registered, caller)) {
            throw RelayException.of(RelayError.INVALID_ROUTER, "caller " + caller + " is not the registered router");
        }
    }

    private void requireAdmin(String caller) {
        if (caller == null || !Addresses.isValid(caller)
                || !roles.hasRole(RoleStore.ADMIN_ROLE, Addresses.normalize(caller))) {
            throw RelayException.of(RelayError.UNAUTHORIZED,
                    "account " + caller + " is missing role " + RoleStore.ADMIN_ROLE);
        }
    }

    private String resolveFeeToken(String feeToken) {
        if (feeToken != null && !feeToken.isBlank()) {
            return Addresses.normalize(feeToken);
        }
        return unitState.get(UnitStateStore.KEY_FEE_TOKEN).orElse(Addresses.ZERO);
    }

    private String tokenOrNative(String token) {
        return token == null || token.isBlank() ? Addresses.ZERO : Addresses.normalize(token);
    }

    private void auditAfterOutcome(AuditLogger.AuditEvent event) {
        try {
            auditLogger.log(event);
        } catch (RuntimeException e) {
            database.recordCompletionFailure("audit " + event.action(), e);
        }
    }

    private void auditRejection(String caller, String messageId, RelayException e, String traceId) {
        rejectedTotal.incrementAndGet();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "message.received",
                String.valueOf(caller),
                "unit/" + unitAddress(),
                "rejected",
                traceId,
                messageId,
                Map.of("error", e.error().wireName(), "reason", e.getMessage())
        ));
    }

    private void auditRole(String action, String caller, String role, String account, boolean changed) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                Addresses.normalize(caller),
                "role/" + role,
                changed ? "updated" : "unchanged",
                TraceContextUtil.newTraceId(),
                null,
                Map.of("account", Addresses.normalize(account), "changed", changed)
        ));
    }

    private AllowlistUpdateOutcome auditAllowlist(String caller, String kind, long chainSelector, String sender,
                                                  boolean allowed, boolean changed) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", kind);
        details.put("chain", ChainSelectors.format(chainSelector));
        if (sender != null) {
            details.put("sender", sender);
        }
        details.put("allowed", allowed);
        details.put("changed", changed);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "allowlist.update",
                Addresses.normalize(caller),
                "allowlist/" + kind,
                changed ? "updated" : "unchanged",
                TraceContextUtil.newTraceId(),
                null,
                details
        ));
        return new AllowlistUpdateOutcome(kind, ChainSelectors.format(chainSelector), sender == null ? "" : sender,
                allowed, changed);
    }

    private void registerDefaultFacets() {
        dispatchTable.register(new NftFacet());
        dispatchTable.register(new NftBridgeFacet());
    }

    private synchronized SettingsReloadOutcome loadSettings() {
        Path file = config.settingsFile();
        boolean exists = Files.exists(file);
        RelaySettings previous = settings;
        RelaySettings resolved = RelaySettings.load(config);
        List<String> changedFields = previous.diff(resolved);
        settings = resolved;
        codec = new MessageCodec(resolved.gasLimit(), resolved.maxPayloadBytes());
        router = injectedRouter != null ? injectedRouter : buildFileRouter(resolved, codec);
        boolean changed = !changedFields.isEmpty();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "runtime.settings.load",
                SYSTEM_ACTOR,
                "runtime/settings",
                exists ? (changed ? "reloaded" : "ok") : "ok_default",
                null,
                null,
                Map.of(
                        "config", file.toString(),
                        "source", exists ? "file" : "defaults",
                        "changed", changed,
                        "changed_count", changedFields.size(),
                        "changed_fields", changedFields
                )
        ));
        return new SettingsReloadOutcome(changed, exists, file.toString(), resolved, changedFields);
    }

    private FileRelayRouter buildFileRouter(RelaySettings source, MessageCodec messageCodec) {
        return new FileRelayRouter(
                source.routerAddress(),
                Path.of(source.relaySpoolDir()),
                source.baseFee(),
                source.feePerByte(),
                messageCodec,
                database,
                Set.of()
        );
    }

    private String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    private final class UnitServices implements FacetServices {
        @Override
        public boolean hasRole(String role, String account) {
            return roles.hasRole(role, Addresses.normalize(account));
        }

        @Override
        public Optional<String> unitState(String key) {
            return unitState.get(key);
        }

        @Override
        public String send(String caller, long destinationChainSelector, String receiver, byte[] data,
                           String token, BigInteger amount, String feeToken) {
            return FacetRelayRuntime.this.send(caller, destinationChainSelector, receiver, data, token, amount, feeToken)
                    .messageId();
        }
    }

    public record InitializeOutcome(String unitAddress, String admin, String router, String feeToken) {
    }

    public record RouterUpdateOutcome(String previous, String current, boolean changed) {
    }

    public record RoleUpdateOutcome(String role, String account, boolean granted, boolean changed) {
    }

    public record AllowlistUpdateOutcome(String kind, String chainSelector, String sender, boolean allowed,
                                         boolean changed) {
    }

    public record AllowlistView(List<String> destinations, List<String> sources, List<String> senders) {
    }

    public record FundOutcome(String asset, String amount, String balance) {
    }

    public record SendOutcome(
            String messageId,
            String destinationChain,
            String receiver,
            String feeToken,
            String fee,
            String traceId
    ) {
    }

    public record ReceiveOutcome(String messageId, ReceiveStatus status, String reason, String traceId) {
    }

    public record RetryOutcome(String messageId, boolean recovered, int attempts, String reason, String traceId) {
    }

    public record CallOutcome(String facet, String signature, String output, String traceId) {
    }

    public record FacetCutOutcome(String action, String facet, List<String> selectors) {
    }

    public record FacetRouteView(String selector, String signature, String facet) {
    }

    public record FailedMessageView(
            String messageId,
            String errorCode,
            String reason,
            String sourceChain,
            String sender,
            String dataBase64,
            int attempts,
            long failedAtMs,
            long updatedAtMs
    ) {
        static FailedMessageView of(FailedMessage message) {
            return new FailedMessageView(
                    message.messageId(),
                    message.errorCode().name(),
                    message.reason(),
                    ChainSelectors.format(message.sourceChainSelector()),
                    message.sender(),
                    Base64.getEncoder().encodeToString(message.data()),
                    message.attempts(),
                    message.failedAtMs(),
                    message.updatedAtMs()
            );
        }
    }

    public record SettingsReloadOutcome(
            boolean changed,
            boolean configExists,
            String sourcePath,
            RelaySettings settings,
            List<String> changedFields
    ) {
    }

    public record StatsOutcome(
            String namespace,
            String unitAddress,
            String chainSelector,
            String relayRouter,
            String registeredRouter,
            boolean initialized,
            long sentTotal,
            long receivedTotal,
            long appliedTotal,
            long failedTotal,
            long recoveredTotal,
            long retryFailedTotal,
            long rejectedTotal,
            long postCommitFailures,
            String lastPostCommitFailure,
            int pendingFailures,
            int recoveredRecords,
            int allowedDestinations,
            int allowedSources,
            int allowedSenders,
            int facets,
            int selectors,
            String nativeBalance
    ) {
    }
}

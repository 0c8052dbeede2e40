package io.facetrelay.cli;

import io.facetrelay.codec.CallData;
import io.facetrelay.config.FacetRelayConfig;
import io.facetrelay.model.ChainSelectors;
import io.facetrelay.router.FileRelayRouter;
import io.facetrelay.runtime.FacetRelayRuntime;
import io.facetrelay.storage.RoleStore;
import io.facetrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "facetrelay",
        mixinStandardHelpOptions = true,
        description = "FacetRelay execution unit CLI",
        subcommands = {
                FacetRelayCommand.InitCommand.class,
                FacetRelayCommand.InitializeCommand.class,
                FacetRelayCommand.AllowDestinationCommand.class,
                FacetRelayCommand.AllowSourceCommand.class,
                FacetRelayCommand.AllowSenderCommand.class,
                FacetRelayCommand.AllowlistCommand.class,
                FacetRelayCommand.SetRouterCommand.class,
                FacetRelayCommand.GrantRoleCommand.class,
                FacetRelayCommand.FundCommand.class,
                FacetRelayCommand.QuoteCommand.class,
                FacetRelayCommand.SendCommand.class,
                FacetRelayCommand.DeliverCommand.class,
                FacetRelayCommand.CallCommand.class,
                FacetRelayCommand.FailedCommand.class,
                FacetRelayCommand.RetryCommand.class,
                FacetRelayCommand.FacetsCommand.class,
                FacetRelayCommand.ReloadSettingsCommand.class,
                FacetRelayCommand.StatsCommand.class,
                FacetRelayCommand.MetricsCommand.class,
                FacetRelayCommand.AuditTailCommand.class,
                FacetRelayCommand.AuditVerifyCommand.class
        }
)
public final class FacetRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Unit data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Unit namespace", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | initialize | allow-destination | allow-source | allow-sender | allowlist | set-router | grant-role | fund | quote | send | deliver | call | failed | retry | facets | reload-settings | stats | metrics | audit-tail | audit-verify");
    }

    FacetRelayRuntime runtime() {
        FacetRelayRuntime runtime = new FacetRelayRuntime(FacetRelayConfig.fromRoot(root, namespace));
        runtime.init();
        return runtime;
    }

    static byte[] callData(String signature, List<String> args) {
        List<String> values = args == null ? List.of() : args;
        return CallData.encode(signature, values.toArray());
    }

    @Command(name = "init", description = "Initialize directories, SQLite schema and settings")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("root", FacetRelayConfig.fromRoot(parent.root, parent.namespace).rootDir().toString());
            out.put("unit", runtime.unitAddress());
            out.put("chain_selector", ChainSelectors.format(runtime.settings().chainSelector()));
            out.put("router", runtime.router().address());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "initialize", description = "One-time provisioning: metadata, registered router, fee token and admin")
    static final class InitializeCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--caller"}, required = true, description = "Account that becomes admin")
        String caller;

        @Option(names = {"--name"}, defaultValue = "", description = "Collection name")
        String name;

        @Option(names = {"--symbol"}, defaultValue = "", description = "Collection symbol")
        String symbol;

        @Option(names = {"--base-uri"}, defaultValue = "", description = "Token URI prefix")
        String baseUri;

        @Option(names = {"--router"}, description = "Registered router address (default: file relay router)")
        String router;

        @Option(names = {"--fee-token"}, description = "Default fee token (default: native)")
        String feeToken;

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.initialize(caller, name, symbol, baseUri, router, feeToken)));
            return 0;
        }
    }

    @Command(name = "allow-destination", description = "Allow or disallow a destination chain")
    static final class AllowDestinationCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--caller"}, required = true, description = "Admin account")
        String caller;

        @Parameters(index = "0", description = "Chain selector")
        String chain;

        @Option(names = {"--disallow"}, description = "Remove the entry instead of adding it")
        boolean disallow;

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(
                    runtime.setDestinationAllowed(caller, ChainSelectors.parse(chain), !disallow)));
            return 0;
        }
    }

    @Command(name = "allow-source", description = "Allow or disallow a source chain")
    static final class AllowSourceCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--caller"}, required = true, description = "Admin account")
        String caller;

        @Parameters(index = "0", description = "Chain selector")
        String chain;

        @Option(names = {"--disallow"}, description = "Remove the entry instead of adding it")
        boolean disallow;

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.setSourceAllowed(caller, ChainSelectors.parse(chain), !disallow)));
            return 0;
        }
    }

    @Command(name = "allow-sender", description = "Allow or disallow a sender from a source chain")
    static final class AllowSenderCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--caller"}, required = true, description = "Admin account")
        String caller;

        @Parameters(index = "0", description = "Source chain selector")
        String chain;

        @Parameters(index = "1", description = "Sender address")
        String sender;

        @Option(names = {"--disallow"}, description = "Remove the entry instead of adding it")
        boolean disallow;

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(
                    runtime.setSenderAllowed(caller, ChainSelectors.parse(chain), sender, !disallow)));
            return 0;
        }
    }

    @Command(name = "allowlist", description = "Show allowlisted destinations, sources and senders")
    static final class AllowlistCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().allowlist()));
            return 0;
        }
    }

    @Command(name = "set-router", description = "Change the registered router address")
    static final class SetRouterCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--caller"}, required = true, description = "Admin account")
        String caller;

        @Parameters(index = "0", description = "Router address")
        String router;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().setRouter(caller, router)));
            return 0;
        }
    }

    @Command(name = "grant-role", description = "Grant or revoke a role")
    static final class GrantRoleCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--caller"}, required = true, description = "Admin account")
        String caller;

        @Option(names = {"--role"}, defaultValue = RoleStore.MINTER_ROLE, description = "Role name")
        String role;

        @Parameters(index = "0", description = "Account address")
        String account;

        @Option(names = {"--revoke"}, description = "Revoke instead of grant")
        boolean revoke;

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            FacetRelayRuntime.RoleUpdateOutcome outcome = revoke
                    ? runtime.revokeRole(caller, role, account)
                    : runtime.grantRole(caller, role, account);
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "fund", description = "Credit the unit wallet with a fee asset")
    static final class FundCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--asset"}, defaultValue = "0x0000000000000000000000000000000000000000",
                description = "Asset address (zero address is native)")
        String asset;

        @Parameters(index = "0", description = "Amount")
        String amount;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().fund(asset, new BigInteger(amount))));
            return 0;
        }
    }

    @Command(name = "quote", description = "Quote the relay fee for a text message")
    static final class QuoteCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--dest"}, required = true, description = "Destination chain selector")
        String dest;

        @Option(names = {"--receiver"}, required = true, description = "Receiving unit address")
        String receiver;

        @Option(names = {"--text"}, defaultValue = "", description = "UTF-8 payload")
        String text;

        @Option(names = {"--fee-token"}, description = "Fee token (default: unit fee token)")
        String feeToken;

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            BigInteger fee = runtime.quoteFee(ChainSelectors.parse(dest), receiver,
                    text.getBytes(StandardCharsets.UTF_8), null, BigInteger.ZERO, feeToken);
            System.out.println(Jsons.toJson(Map.of("destination_chain", dest, "fee", fee.toString())));
            return 0;
        }
    }

    @Command(name = "send", description = "Send a cross-chain message paid from the unit wallet")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--caller"}, required = true, description = "Calling account")
        String caller;

        @Option(names = {"--dest"}, required = true, description = "Destination chain selector")
        String dest;

        @Option(names = {"--receiver"}, required = true, description = "Receiving unit address")
        String receiver;

        @Option(names = {"--text"}, description = "UTF-8 payload")
        String text;

        @Option(names = {"--signature"}, description = "Function signature to encode as call data")
        String signature;

        @Option(names = {"--arg"}, description = "Call data argument, repeatable")
        List<String> args = new ArrayList<>();

        @Option(names = {"--token"}, description = "Token of the transferred amount (default: native)")
        String token;

        @Option(names = {"--amount"}, defaultValue = "0", description = "Transferred amount")
        String amount;

        @Option(names = {"--fee-token"}, description = "Fee token (default: unit fee token)")
        String feeToken;

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            byte[] data;
            if (signature != null && !signature.isBlank()) {
                data = callData(signature, args);
            } else {
                data = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
            }
            FacetRelayRuntime.SendOutcome outcome = runtime.send(
                    caller, ChainSelectors.parse(dest), receiver, data, token, new BigInteger(amount), feeToken);
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "deliver", description = "Deliver pending relay messages addressed to this unit's chain")
    static final class DeliverCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--max"}, defaultValue = "100", description = "Maximum messages to deliver")
        int max;

        @Override
        public Integer call() {
            FileRelayRouter.DeliverySummary summary = parent.runtime().deliverPending(max);
            System.out.println(Jsons.toJson(summary));
            return summary.rejected() == 0 ? 0 : 1;
        }
    }

    @Command(name = "call", description = "Call the unit through its dispatch table")
    static final class CallCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--caller"}, required = true, description = "Calling account")
        String caller;

        @Parameters(index = "0", description = "Function signature, e.g. ownerOf(uint256)")
        String signature;

        @Parameters(index = "1..*", description = "Arguments")
        List<String> args = new ArrayList<>();

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.call(caller, callData(signature, args))));
            return 0;
        }
    }

    @Command(name = "failed", description = "List failed messages pending recovery")
    static final class FailedCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--id"}, description = "Show one message id")
        String messageId;

        @Option(names = {"--offset"}, defaultValue = "0", description = "Rows to skip")
        int offset;

        @Option(names = {"--limit"}, defaultValue = "" + FacetRelayConfig.DEFAULT_FAILED_PAGE_SIZE,
                description = "Maximum rows")
        int limit;

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            if (messageId != null && !messageId.isBlank()) {
                var found = runtime.failedMessage(messageId);
                if (found.isEmpty()) {
                    System.out.println(Jsons.toJson(Map.of(
                            "message_id", messageId,
                            "error_code", runtime.errorCodeOf(messageId).name())));
                    return 1;
                }
                System.out.println(Jsons.toJson(found.get()));
                return 0;
            }
            System.out.println(Jsons.toJson(runtime.failedMessages(offset, limit)));
            return 0;
        }
    }

    @Command(name = "retry", description = "Re-apply a failed message, optionally with a replacement payload")
    static final class RetryCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--caller"}, required = true, description = "Operator account")
        String caller;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Option(names = {"--signature"}, description = "Replacement call data signature")
        String signature;

        @Option(names = {"--arg"}, description = "Replacement call data argument, repeatable")
        List<String> args = new ArrayList<>();

        @Override
        public Integer call() {
            FacetRelayRuntime runtime = parent.runtime();
            byte[] data = signature == null || signature.isBlank() ? null : callData(signature, args);
            FacetRelayRuntime.RetryOutcome outcome = runtime.retryFailedMessage(caller, messageId, data);
            System.out.println(Jsons.toJson(outcome));
            return outcome.recovered() ? 0 : 1;
        }
    }

    @Command(name = "facets", description = "List selector routes")
    static final class FacetsCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().facets()));
            return 0;
        }
    }

    @Command(name = "reload-settings", description = "Reload facetrelay-settings.json")
    static final class ReloadSettingsCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().reloadSettings()));
            return 0;
        }
    }

    @Command(name = "stats", description = "Show unit counters and ledger state")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().stats()));
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Override
        public Integer call() {
            System.out.print(parent.runtime().metricsText());
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        public Integer call() {
            for (String row : parent.runtime().auditTail(lines)) {
                System.out.println(row);
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        FacetRelayCommand parent;

        @Override
        public Integer call() {
            var report = parent.runtime().verifyAuditIntegrity();
            System.out.println(Jsons.toJson(report));
            return report.ok() ? 0 : 1;
        }
    }
}

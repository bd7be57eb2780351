package org.pragmatica.structlab.dispatch;

import org.pragmatica.structlab.command.Command;
import org.pragmatica.structlab.command.Family;
import org.pragmatica.structlab.command.StructureType;
import org.pragmatica.structlab.command.Target;
import org.pragmatica.structlab.engine.linear.ArrayListStructure;
import org.pragmatica.structlab.engine.linear.IndexedList;
import org.pragmatica.structlab.engine.linear.LinearStructure;
import org.pragmatica.structlab.engine.linear.LinkedListStructure;
import org.pragmatica.structlab.engine.linear.StackStructure;
import org.pragmatica.structlab.engine.tree.AvlTree;
import org.pragmatica.structlab.engine.tree.BinarySearchTree;
import org.pragmatica.structlab.engine.tree.BinaryTreeStructure;
import org.pragmatica.structlab.engine.tree.HuffmanTree;
import org.pragmatica.structlab.engine.tree.OrderedTree;
import org.pragmatica.structlab.engine.tree.TreeStructure;
import org.pragmatica.structlab.error.CommandError;
import org.pragmatica.structlab.lang.Cause;
import org.pragmatica.structlab.lang.Result;
import org.pragmatica.structlab.parser.CommandClassifier;
import org.pragmatica.structlab.snapshot.StepTrace;
import org.pragmatica.structlab.snapshot.TraceStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Validates commands against the live structures and routes them to the engines.
 *
 * <p>Keeps one slot per family. A {@code build} leaves the tree slot in the building state: the
 * driver pulls frames with {@link #advanceBuild()} or {@link #completeBuild()}, and tree commands
 * arriving meanwhile are queued and replayed once the build is done. {@code clear} and a
 * replacing {@code create}/{@code build} cancel the build and drop the queue.
 *
 * <p>No exception escapes {@link #submit(String)} or {@link #execute(Command)}; every failure
 * becomes an error result.
 */
public final class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final EngineConfig config;
    private final CommandListener listener;
    private final StructureContext context = new StructureContext();

    private Dispatcher(EngineConfig config, CommandListener listener) {
        this.config = config;
        this.listener = listener;
    }

    public static Dispatcher create(EngineConfig config) {
        return new Dispatcher(config, CommandListener.NONE);
    }

    public static Dispatcher create(EngineConfig config, CommandListener listener) {
        return new Dispatcher(config, listener);
    }

    public EngineConfig config() {
        return config;
    }

    public StructureContext context() {
        return context;
    }

    public boolean isBuilding() {
        return context.tree()
                      .state() == StructureContext.SlotState.BUILDING;
    }

    /**
     * Read and execute one line of command text.
     */
    public CommandResult submit(String text) {
        log.debug("Submitted: {}", text);
        Result<Command> command;
        try {
            command = CommandReader.read(text);
        } catch (RuntimeException e) {
            log.warn("Failed to read command '{}'", text, e);
            return CommandResult.failure(null, new CommandError.InternalFailure("read", e));
        }
        return command.fold(cause -> rejected(text, cause), parsed -> execute(text, parsed));
    }

    /**
     * Execute an already normalized command.
     */
    public CommandResult execute(Command command) {
        return execute(command.op(), command);
    }

    private CommandResult execute(String source, Command command) {
        CommandResult result;
        if (command.family() == Family.TREE && isBuilding() && !cancelsBuild(command)) {
            context.tree()
                   .build()
                   .ifPresent(build -> build.enqueue(source, command));
            log.debug("Queued {} until the build completes", command.op());
            result = CommandResult.success(Family.TREE, "queued: " + command.op() + " runs after the build");
        } else {
            result = executeGuarded(command);
        }
        listener.onResult(command, result);
        return result;
    }

    /**
     * Play the next frame of the running build. The frame that exhausts the trace also makes the
     * tree ready and replays queued commands.
     *
     * @return empty if no build is in progress
     */
    public Optional<BuildStep> advanceBuild() {
        var build = context.tree()
                           .build();
        if (build.isEmpty()) {
            return Optional.empty();
        }
        var step = build.get()
                        .next();
        if (!build.get()
                  .isExhausted()) {
            return Optional.of(new BuildStep(step, false, List.of()));
        }
        return Optional.of(new BuildStep(step, true, finishBuild(build.get())));
    }

    /**
     * Play all remaining frames at once.
     *
     * @return the last frame with the replayed results, or empty if no build is in progress
     */
    public Optional<BuildStep> completeBuild() {
        var build = context.tree()
                           .build();
        if (build.isEmpty()) {
            return Optional.empty();
        }
        Optional<TraceStep> last = Optional.empty();
        while (!build.get()
                     .isExhausted()) {
            last = build.get()
                        .next();
        }
        return Optional.of(new BuildStep(last, true, finishBuild(build.get())));
    }

    private List<ScriptReport.Entry> finishBuild(BuildProgress build) {
        context.tree()
               .finishBuild();
        var queued = build.pending();
        log.info("Build of {} complete, replaying {} queued command(s)", treeType(), queued.size());
        var replayed = new ArrayList<ScriptReport.Entry>(queued.size());
        for (var pending : queued) {
            var result = executeGuarded(pending.command());
            listener.onResult(pending.command(), result);
            replayed.add(new ScriptReport.Entry(pending.source(), result));
        }
        return replayed;
    }

    private CommandResult rejected(String text, Cause cause) {
        var family = CommandClassifier.classify(text)
                                      .family()
                                      .filter(candidate -> candidate != Family.GLOBAL)
                                      .orElse(null);
        var result = CommandResult.failure(family, asCommandError("read", cause));
        log.debug("Rejected '{}': {}", text, result.message());
        return result;
    }

    private CommandResult executeGuarded(Command command) {
        try {
            var result = dispatch(command);
            if (!result.isSuccess()) {
                log.debug("{} failed: {}", command.op(), result.message());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Unexpected failure executing {}", command, e);
            return CommandResult.failure(family(command), new CommandError.InternalFailure(command.op(), e));
        }
    }

    private CommandResult dispatch(Command command) {
        if (command instanceof Command.ClearAll) {
            return clearAll();
        }
        if (command instanceof Command.LinearCommand linear) {
            return linear(linear);
        }
        if (command instanceof Command.TreeCommand tree) {
            return tree(tree);
        }
        throw new IllegalStateException("Unsupported command " + command);
    }

    // === Global ===

    private CommandResult clearAll() {
        var cleared = new ArrayList<String>();
        context.linear()
               .structure()
               .ifPresent(structure -> cleared.add(structure.type()));
        context.tree()
               .structure()
               .ifPresent(structure -> cleared.add(structure.type()));
        context.linear()
               .reset();
        context.tree()
               .reset()
               .ifPresent(this::logCancelled);
        log.info("Cleared all structures {}", cleared);
        return CommandResult.success(null,
                                     cleared.isEmpty()
                                     ? "Nothing to clear"
                                     : "Cleared " + String.join(" and ", cleared));
    }

    // === Linear ===

    private CommandResult linear(Command.LinearCommand command) {
        if (command instanceof Command.CreateLinear create) {
            return createLinear(create);
        }
        var live = liveLinear(command.type());
        if (live.isFailure()) {
            return live.fold(cause -> failure(Family.LINEAR, cause), unused -> null);
        }
        var structure = live.unwrap();
        if (command instanceof Command.ClearLinear) {
            context.linear()
                   .reset();
            log.info("Cleared {}", structure.type());
            return CommandResult.success(Family.LINEAR, "Cleared " + structure.type());
        }
        if (command instanceof Command.GetLinear get) {
            return getLinear(structure, get.target());
        }
        if (command instanceof Command.InsertLinear insert) {
            return indexed(structure, "insert").fold(cause -> failure(Family.LINEAR, cause),
                                                     list -> insertLinear(list, insert));
        }
        if (command instanceof Command.DeleteLinear delete) {
            return indexed(structure, "delete").fold(cause -> failure(Family.LINEAR, cause),
                                                     list -> deleteLinear(list, delete.target()));
        }
        if (!(structure instanceof StackStructure stack)) {
            return failure(Family.LINEAR,
                           new CommandError.TypeMismatch(command.op() + " is only supported by stack, not "
                                                         + structure.type()));
        }
        if (command instanceof Command.Push push) {
            stack.push(push.value());
            return linearSuccess("Pushed " + push.value());
        }
        if (command instanceof Command.Pop) {
            return linearOutcome(stack.pop()
                                      .map(value -> "Popped " + value));
        }
        if (command instanceof Command.Peek) {
            return linearOutcome(stack.peek()
                                      .map(value -> "Top is " + value));
        }
        throw new IllegalStateException("Unsupported linear command " + command);
    }

    private CommandResult createLinear(Command.CreateLinear create) {
        var capacity = create.capacity()
                             .orElse(config.defaultCapacity());
        LinearStructure structure = switch (create.type()) {
            case ARRAY_LIST -> ArrayListStructure.create(create.values(), capacity, config.minimumCapacity());
            case STACK -> StackStructure.create(create.values(), capacity, config.minimumCapacity());
            case LINKED_LIST -> LinkedListStructure.create(create.values());
            default -> throw new IllegalStateException("Not a linear type: " + create.type());
        };
        var replaced = context.linear()
                              .structure()
                              .map(LinearStructure::type);
        context.linear()
               .install(structure);
        log.info("Created {}{}", structure.type(), replaced.map(type -> ", replacing " + type)
                                                           .orElse(""));
        return linearSuccess("Created " + structure.type() + " " + structure.toList());
    }

    private CommandResult insertLinear(IndexedList list, Command.InsertLinear insert) {
        var index = insert.position()
                          .orElse(list.size());
        return linearOutcome(list.insert(index, insert.value())
                                 .map(unit -> "Inserted " + insert.value() + " at " + index));
    }

    private CommandResult deleteLinear(IndexedList list, Target target) {
        if (target instanceof Target.Position position) {
            return linearOutcome(list.delete(position.value())
                                     .map(value -> "Deleted " + value + " at " + position.value()));
        }
        return linearOutcome(list.indexOf(target.value())
                                 .flatMap(index -> list.delete(index)
                                                       .map(value -> "Deleted " + value + " at " + index)));
    }

    private CommandResult getLinear(LinearStructure structure, Target target) {
        if (target instanceof Target.Position position) {
            return linearOutcome(structure.get(position.value())
                                          .map(value -> "Value at " + position.value() + " is " + value));
        }
        return linearOutcome(structure.indexOf(target.value())
                                      .map(index -> "Value " + target.value() + " is at " + index));
    }

    private Result<LinearStructure> liveLinear(StructureType named) {
        var slot = context.linear();
        if (slot.state() == StructureContext.SlotState.UNINITIALIZED) {
            return new CommandError.NotInitialized(Family.LINEAR.label()).result();
        }
        var structure = slot.structure()
                            .orElseThrow();
        if (!structure.type()
                      .equals(named.canonicalName())) {
            return new CommandError.TypeMismatch("Live linear structure is " + structure.type() + ", not " + named)
                .result();
        }
        return Result.success(structure);
    }

    private static Result<IndexedList> indexed(LinearStructure structure, String op) {
        if (structure instanceof IndexedList list) {
            return Result.success(list);
        }
        return new CommandError.TypeMismatch(op + " is not supported by " + structure.type() + ", use push/pop")
            .result();
    }

    private CommandResult linearOutcome(Result<String> outcome) {
        return outcome.fold(cause -> failure(Family.LINEAR, cause), this::linearSuccess);
    }

    private CommandResult linearSuccess(String message) {
        return CommandResult.success(Family.LINEAR,
                                     message,
                                     context.linear()
                                            .structure()
                                            .map(LinearStructure::snapshot)
                                            .orElse(null));
    }

    // === Tree ===

    private CommandResult tree(Command.TreeCommand command) {
        if (command instanceof Command.CreateTree create) {
            return createTree(create);
        }
        if (command instanceof Command.CreateHuffman create) {
            var huffman = HuffmanTree.create(config.singleSymbolCode());
            huffman.build(create.frequencies());
            return installTree(huffman, "Created " + HuffmanTree.TYPE + " with codes " + huffman.codeTable()
                                                                                            .codes());
        }
        if (command instanceof Command.BuildTree build) {
            return buildTree(build);
        }
        if (command instanceof Command.BuildHuffman build) {
            var huffman = HuffmanTree.create(config.singleSymbolCode());
            return startBuild(huffman, huffman.build(build.frequencies()));
        }
        var live = liveTree(command.structureType());
        if (live.isFailure()) {
            return live.fold(cause -> failure(Family.TREE, cause), unused -> null);
        }
        var structure = live.unwrap();
        if (command instanceof Command.ClearTree) {
            context.tree()
                   .reset()
                   .ifPresent(this::logCancelled);
            log.info("Cleared {}", structure.type());
            return CommandResult.success(Family.TREE, "Cleared " + structure.type());
        }
        if (command instanceof Command.InsertTree insert) {
            return insertTree(structure, insert);
        }
        if (command instanceof Command.DeleteTree delete) {
            return deleteTree(structure, delete);
        }
        if (command instanceof Command.Search search) {
            return search(structure, search.value());
        }
        if (command instanceof Command.Traverse traverse) {
            if (!(structure instanceof BinaryTreeStructure binaryTree)) {
                return failure(Family.TREE,
                               new CommandError.TypeMismatch("traverse is defined for binary_tree only, not "
                                                             + structure.type()));
            }
            var order = traverse.order()
                                .keyword();
            return treeSuccess(order + ": " + binaryTree.traverse(traverse.order()), null);
        }
        if (!(structure instanceof HuffmanTree huffman)) {
            return failure(Family.TREE,
                           new CommandError.TypeMismatch(command.op() + " requires huffman_tree, not "
                                                         + structure.type()));
        }
        if (command instanceof Command.Encode encode) {
            return treeSuccess("Encoded \"" + encode.text() + "\" as " + huffman.encode(encode.text()), null);
        }
        if (command instanceof Command.Decode decode) {
            return huffman.decode(decode.bits(), config.decodeMode())
                          .fold(cause -> failure(Family.TREE, cause),
                                text -> treeSuccess("Decoded " + decode.bits() + " as \"" + text + "\"", null));
        }
        throw new IllegalStateException("Unsupported tree command " + command);
    }

    private CommandResult createTree(Command.CreateTree create) {
        TreeStructure structure = switch (create.type()) {
            case BINARY_TREE -> BinaryTreeStructure.build(create.values());
            case BST -> BinarySearchTree.create(create.values());
            case AVL -> AvlTree.create(create.values());
            case HUFFMAN -> null;
            default -> throw new IllegalStateException("Not a tree type: " + create.type());
        };
        if (structure == null) {
            return failure(Family.TREE,
                           new CommandError.TypeMismatch("huffman_tree is created from symbol frequencies, e.g. "
                                                         + "'create huffman with a:5,b:9'"));
        }
        return installTree(structure, "Created " + structure.type() + " with " + structure.size() + " nodes");
    }

    private CommandResult buildTree(Command.BuildTree build) {
        OrderedTree tree = switch (build.type()) {
            case BST -> BinarySearchTree.create(List.of());
            case AVL -> AvlTree.create(List.of());
            default -> null;
        };
        if (tree == null) {
            return failure(Family.TREE,
                           new CommandError.TypeMismatch("build applies to bst, avl_tree and huffman_tree, not "
                                                         + build.type()));
        }
        return startBuild(tree, tree.buildWithSteps(build.values()));
    }

    private CommandResult installTree(TreeStructure structure, String message) {
        var previous = context.tree()
                              .structure()
                              .map(TreeStructure::type);
        context.tree()
               .install(structure)
               .ifPresent(this::logCancelled);
        log.info("Created {}{}", structure.type(), previous.map(type -> ", replacing " + type)
                                                           .orElse(""));
        return treeSuccess(message, null);
    }

    private CommandResult startBuild(TreeStructure structure, StepTrace trace) {
        context.tree()
               .startBuild(structure, trace)
               .ifPresent(this::logCancelled);
        log.info("Building {} in {} steps", structure.type(), trace.length());
        return CommandResult.success(Family.TREE,
                                     "Building " + structure.type() + " in " + trace.length() + " steps",
                                     trace.step(0)
                                          .snapshot(),
                                     trace);
    }

    private CommandResult insertTree(TreeStructure structure, Command.InsertTree insert) {
        if (structure instanceof BinaryTreeStructure binaryTree) {
            if (insert.path()
                      .isEmpty()) {
                binaryTree.insert(insert.value());
                return treeSuccess("Inserted " + insert.value(), null);
            }
            var path = insert.path()
                             .get();
            return binaryTree.insert(insert.value(), path)
                             .fold(cause -> failure(Family.TREE, cause),
                                   id -> treeSuccess("Inserted " + insert.value() + " at " + path, null));
        }
        if (structure instanceof OrderedTree ordered) {
            var mutation = ordered.insert(insert.value());
            return treeSuccess(mutation.changed()
                               ? "Inserted " + insert.value()
                               : insert.value() + " already present, tree unchanged",
                               mutation.trace()
                                       .orElse(null));
        }
        return failure(Family.TREE, new CommandError.TypeMismatch("insert is not supported by " + structure.type()));
    }

    private CommandResult deleteTree(TreeStructure structure, Command.DeleteTree delete) {
        if (structure instanceof BinaryTreeStructure binaryTree) {
            var path = delete.path()
                             .orElseThrow();
            return binaryTree.delete(path, delete.value())
                             .fold(cause -> failure(Family.TREE, cause),
                                   value -> treeSuccess("Deleted " + value + " at " + path, null));
        }
        if (structure instanceof OrderedTree ordered) {
            var value = delete.value()
                              .orElseThrow();
            var mutation = ordered.delete(value);
            if (!mutation.changed()) {
                return failure(Family.TREE,
                               new CommandError.NotFound("Value " + value + " not found in " + structure.type()));
            }
            return treeSuccess("Deleted " + value,
                               mutation.trace()
                                       .orElse(null));
        }
        return failure(Family.TREE, new CommandError.TypeMismatch("delete is not supported by " + structure.type()));
    }

    private CommandResult search(TreeStructure structure, int value) {
        if (!(structure instanceof OrderedTree ordered)) {
            return failure(Family.TREE,
                           new CommandError.TypeMismatch("search requires bst or avl_tree, not " + structure.type()));
        }
        var result = ordered.search(value);
        var path = result.pathValues()
                         .stream()
                         .map(String::valueOf)
                         .collect(Collectors.joining(" -> "));
        return treeSuccess(result.found()
                           ? "Found " + value + " via " + path
                           : value + " not found" + (path.isEmpty()
                                                     ? ""
                                                     : " after " + path),
                           ordered.searchWithSteps(value));
    }

    private Result<TreeStructure> liveTree(Optional<StructureType> named) {
        var slot = context.tree();
        if (slot.state() == StructureContext.SlotState.UNINITIALIZED) {
            return new CommandError.NotInitialized(Family.TREE.label()).result();
        }
        var structure = slot.structure()
                            .orElseThrow();
        if (named.isPresent() && !structure.type()
                                           .equals(named.get()
                                                        .canonicalName())) {
            return new CommandError.TypeMismatch("Live tree is " + structure.type() + ", not " + named.get())
                .result();
        }
        return Result.success(structure);
    }

    private CommandResult treeSuccess(String message, StepTrace trace) {
        return CommandResult.success(Family.TREE,
                                     message,
                                     context.tree()
                                            .structure()
                                            .map(TreeStructure::snapshot)
                                            .orElse(null),
                                     trace);
    }

    // === Shared ===

    private static boolean cancelsBuild(Command command) {
        return command instanceof Command.ClearTree
               || command instanceof Command.CreateTree
               || command instanceof Command.CreateHuffman
               || command instanceof Command.BuildTree
               || command instanceof Command.BuildHuffman;
    }

    private void logCancelled(BuildProgress build) {
        log.info("Cancelled build with {} remaining step(s), dropped {} queued command(s)",
                 build.remaining(),
                 build.queued()
                      .size());
    }

    private String treeType() {
        return context.tree()
                      .structure()
                      .map(TreeStructure::type)
                      .orElse("tree");
    }

    private static CommandResult failure(Family family, Cause cause) {
        return CommandResult.failure(family, asCommandError("execute", cause));
    }

    private static CommandError asCommandError(String operation, Cause cause) {
        if (cause instanceof CommandError error) {
            return error;
        }
        return new CommandError.InternalFailure(operation, new IllegalStateException(cause.message()));
    }

    private static Family family(Command command) {
        return command.family() == Family.GLOBAL
               ? null
               : command.family();
    }
}

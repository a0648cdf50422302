package com.archlens.core.assembler;

import com.archlens.core.model.ArchitectureGraph;
import com.archlens.core.model.Bounds;
import com.archlens.core.model.Cluster;
import com.archlens.core.model.Dependency;
import com.archlens.core.model.Edge;
import com.archlens.core.model.EdgeKind;
import com.archlens.core.model.EdgeStyle;
import com.archlens.core.model.LineStyle;
import com.archlens.core.model.Node;
import com.archlens.core.model.NodeDisplay;
import com.archlens.core.model.NodeKind;
import com.archlens.core.model.NodeStatus;
import com.archlens.core.model.Position;
import com.archlens.core.model.ProjectStructure;
import com.archlens.core.model.StructureFile;
import com.archlens.core.util.FileUtils;
import com.archlens.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the typed node/edge/cluster graph and lays it out.
 *
 * <p><b>Clusters:</b> one cluster per directory, linked to its parent directory's
 * cluster, so clusters mirror the directory tree. Root-level files belong to the
 * {@code ROOT} cluster, which is the parent of every top-level directory. Documentation
 * files go to a dedicated {@code doc_shelf} cluster and external modules to an
 * {@code external_modules} cluster.
 *
 * <p><b>Layout:</b> files are grouped by their parent directory. Inside a group, files
 * are ordered by layer, priority and path and laid on a {@value #GROUP_COLUMNS}-column
 * grid with {@value #NODE_SPACING}px spacing; every layer starts a new row block so
 * layers stack vertically. Groups tile in a {@code ceil(sqrt(groups))}-column grid of
 * {@value #CELL_WIDTH}x{@value #CELL_HEIGHT} cells, each column and row grown to fit
 * its largest group. The documentation shelf sits at negative x, the external
 * modules to the right of the grid.
 *
 * <p>Inputs are sorted before layout, so the output is a pure function of the files,
 * directories, dependencies and layer hints.
 */
public class GraphAssembler {

    private static final Logger log = LoggerFactory.getLogger(GraphAssembler.class);

    public static final String ROOT_CLUSTER_LABEL = "ROOT";
    public static final String DOC_SHELF_ID = "doc_shelf";
    public static final String EXTERNAL_CLUSTER_ID = "external_modules";

    static final String NODE_ID_PREFIX = "node_";
    static final String EDGE_ID_PREFIX = "edge_";
    static final String CLUSTER_ID_PREFIX = "cluster_";

    static final int GROUP_COLUMNS = 4;
    static final int NODE_SPACING = 150;
    static final int NODE_MARGIN = 50;
    static final int CELL_WIDTH = 600;
    static final int CELL_HEIGHT = 400;
    static final int CELL_GAP = 50;
    static final int DOC_COLUMNS = 2;
    static final int DOC_SPACING = 120;
    static final int EXTERNAL_COLUMNS = 2;
    static final int EXTERNAL_GAP = 200;

    private static final double PROPOSED_OPACITY = 0.5;
    private static final String PROPOSED_DASH = "5,5";
    private static final String EXTERNAL_LABEL_PREFIX = "[ext] ";
    private static final LayerHint EXTERNAL_HINT = new LayerHint(LayerHint.ACTION, 100);

    private static final Map<NodeKind, String> NODE_COLORS = new EnumMap<>(Map.of(
        NodeKind.SOURCE, "#b8bb26",
        NodeKind.CLUSTER, "#83a598",
        NodeKind.DOCUMENTATION, "#fabd2f",
        NodeKind.TEST, "#fe8019",
        NodeKind.CONFIG, "#d3869b",
        NodeKind.HISTORY, "#d65d0e",
        NodeKind.EXTERNAL, "#928374"
    ));

    private static final Map<EdgeKind, EdgeStyle> EDGE_STYLES = new EnumMap<>(Map.of(
        EdgeKind.DEPENDENCY, new EdgeStyle(2, LineStyle.DASHED, "#ebdbb2", false),
        EdgeKind.DATA_FLOW, new EdgeStyle(3, LineStyle.DASHED, "#83a598", false),
        EdgeKind.EVENT, new EdgeStyle(2, LineStyle.DASHED, "#fe8019", false),
        EdgeKind.CONDITIONAL, new EdgeStyle(1, LineStyle.DASHED, "#d3869b", false),
        EdgeKind.ORIGIN, new EdgeStyle(1.5, LineStyle.DASHED, "#d65d0e", false)
    ));

    private final LayerClassifier layerClassifier;

    public GraphAssembler() {
        this(new FileNameLayerClassifier());
    }

    public GraphAssembler(LayerClassifier layerClassifier) {
        this.layerClassifier = Objects.requireNonNull(layerClassifier, "layerClassifier must not be null");
    }

    /**
     * Assembles the graph of a project structure.
     *
     * @param structure folders, files, resolved dependencies and external tokens
     * @return laid-out graph
     */
    public ArchitectureGraph assemble(ProjectStructure structure) {
        Objects.requireNonNull(structure, "structure must not be null");

        Map<String, StructureFile> files = new TreeMap<>();
        for (StructureFile file : structure.files()) {
            files.putIfAbsent(FileUtils.normalize(file.path()), file);
        }

        Map<String, List<StructureFile>> groups = new TreeMap<>();
        List<StructureFile> documents = new ArrayList<>();
        for (Map.Entry<String, StructureFile> entry : files.entrySet()) {
            if (entry.getValue().kind() == NodeKind.DOCUMENTATION) {
                documents.add(entry.getValue());
            } else {
                groups.computeIfAbsent(FileUtils.parentOf(entry.getKey()), key -> new ArrayList<>()).add(entry.getValue());
            }
        }

        ClusterIds clusterIds = new ClusterIds();
        Set<String> directories = directoriesOf(structure.folders(), groups.keySet());
        List<Node> nodes = new ArrayList<>();
        Map<String, List<String>> members = new LinkedHashMap<>();
        Map<String, Bounds> groupBounds = new HashMap<>();

        double gridRight = layoutGroups(groups, clusterIds, nodes, members, groupBounds);
        List<Cluster> clusters = new ArrayList<>(directoryClusters(directories, clusterIds, members, groupBounds));

        if (!documents.isEmpty()) {
            clusters.add(layoutDocShelf(documents, nodes));
        }

        TreeSet<String> externalTokens = new TreeSet<>(structure.externalTokens());
        for (Dependency dependency : structure.dependencies()) {
            if (dependency.targetsExternal()) {
                externalTokens.add(dependency.to().substring(Dependency.EXTERNAL_PREFIX.length()));
            }
        }
        if (!externalTokens.isEmpty()) {
            clusters.add(layoutExternals(externalTokens, gridRight + EXTERNAL_GAP, nodes));
        }

        List<Edge> edges = buildEdges(structure.dependencies(), nodes);

        log.info("Assembled graph: {} nodes, {} edges, {} clusters", nodes.size(), edges.size(), clusters.size());
        return new ArchitectureGraph(nodes, edges, clusters);
    }

    // ==================== Directory groups ====================

    private double layoutGroups(Map<String, List<StructureFile>> groups, ClusterIds clusterIds, List<Node> nodes,
                                Map<String, List<String>> members, Map<String, Bounds> groupBounds) {
        List<String> directories = new ArrayList<>(groups.keySet());
        int gridColumns = (int) Math.ceil(Math.sqrt(directories.size()));
        if (gridColumns == 0) {
            return 0;
        }

        Map<String, GroupLayout> layouts = new HashMap<>();
        for (String directory : directories) {
            layouts.put(directory, layoutGroup(groups.get(directory)));
        }

        int gridRows = (directories.size() + gridColumns - 1) / gridColumns;
        double[] columnWidths = new double[gridColumns];
        double[] rowHeights = new double[gridRows];
        for (int i = 0; i < directories.size(); i++) {
            GroupLayout layout = layouts.get(directories.get(i));
            int column = i % gridColumns;
            int row = i / gridColumns;
            columnWidths[column] = Math.max(Math.max(columnWidths[column], CELL_WIDTH), layout.width() + CELL_GAP);
            rowHeights[row] = Math.max(Math.max(rowHeights[row], CELL_HEIGHT), layout.height() + CELL_GAP);
        }

        for (int i = 0; i < directories.size(); i++) {
            String directory = directories.get(i);
            GroupLayout layout = layouts.get(directory);
            double originX = sum(columnWidths, i % gridColumns);
            double originY = sum(rowHeights, i / gridColumns);
            String clusterId = clusterIds.forDirectory(directory);

            List<String> memberIds = new ArrayList<>();
            for (PlacedFile placed : layout.files()) {
                Node node = fileNode(placed.file(), placed.hint(), clusterId,
                    new Position(originX + placed.x(), originY + placed.y()));
                nodes.add(node);
                memberIds.add(node.id());
            }
            members.put(directory, memberIds);
            groupBounds.put(directory, new Bounds(originX, originY, layout.width(), layout.height()));
        }
        return sum(columnWidths, gridColumns);
    }

    private GroupLayout layoutGroup(List<StructureFile> files) {
        List<PlacedFile> ordered = new ArrayList<>();
        for (StructureFile file : files) {
            ordered.add(new PlacedFile(file, layerClassifier.classify(file.path()), 0, 0));
        }
        ordered.sort(Comparator.comparingInt((PlacedFile placed) -> placed.hint().layer())
            .thenComparingInt(placed -> placed.hint().priority())
            .thenComparing(placed -> placed.file().path()));

        List<PlacedFile> placedFiles = new ArrayList<>();
        int rowOffset = 0;
        int widestRow = 0;
        int index = 0;
        while (index < ordered.size()) {
            int layer = ordered.get(index).hint().layer();
            int inLayer = 0;
            while (index < ordered.size() && ordered.get(index).hint().layer() == layer) {
                PlacedFile file = ordered.get(index);
                int column = inLayer % GROUP_COLUMNS;
                int row = rowOffset + inLayer / GROUP_COLUMNS;
                placedFiles.add(new PlacedFile(file.file(), file.hint(),
                    column * NODE_SPACING + NODE_MARGIN, row * NODE_SPACING + NODE_MARGIN));
                inLayer++;
                index++;
            }
            widestRow = Math.max(widestRow, Math.min(inLayer, GROUP_COLUMNS));
            rowOffset += (inLayer + GROUP_COLUMNS - 1) / GROUP_COLUMNS;
        }

        double width = widestRow * NODE_SPACING + 2.0 * NODE_MARGIN;
        double height = rowOffset * NODE_SPACING + 2.0 * NODE_MARGIN;
        return new GroupLayout(placedFiles, width, height);
    }

    private List<Cluster> directoryClusters(Set<String> directories, ClusterIds clusterIds,
                                            Map<String, List<String>> members, Map<String, Bounds> groupBounds) {
        // Deepest directories first so every parent sees the final bounds of its children.
        List<String> deepestFirst = new ArrayList<>(directories);
        deepestFirst.sort(Comparator.comparingInt(GraphAssembler::depthOf).reversed().thenComparing(Comparator.naturalOrder()));

        Map<String, Bounds> bounds = new HashMap<>(groupBounds);
        for (String directory : deepestFirst) {
            if (".".equals(directory)) {
                continue;
            }
            String parent = FileUtils.parentOf(directory);
            Bounds own = bounds.get(directory);
            if (own != null) {
                bounds.merge(parent, own, GraphAssembler::union);
            }
        }

        List<Cluster> clusters = new ArrayList<>();
        for (String directory : directories) {
            String parentId = ".".equals(directory) ? null : clusterIds.forDirectory(FileUtils.parentOf(directory));
            String label = ".".equals(directory) ? ROOT_CLUSTER_LABEL : directory;
            clusters.add(new Cluster(
                clusterIds.forDirectory(directory),
                label,
                parentId,
                members.getOrDefault(directory, List.of()),
                bounds.getOrDefault(directory, new Bounds(0, 0, 0, 0)),
                false
            ));
        }
        return clusters;
    }

    private static Set<String> directoriesOf(List<String> folders, Set<String> fileDirectories) {
        TreeSet<String> directories = new TreeSet<>(Comparator.comparing((String dir) -> !".".equals(dir))
            .thenComparing(Comparator.naturalOrder()));
        List<String> seeds = new ArrayList<>(fileDirectories);
        folders.stream().map(FileUtils::normalize).filter(folder -> !folder.isEmpty()).forEach(seeds::add);
        for (String seed : seeds) {
            String directory = seed;
            while (directories.add(directory) && !".".equals(directory)) {
                directory = FileUtils.parentOf(directory);
            }
        }
        return directories;
    }

    // ==================== Documentation shelf and externals ====================

    private Cluster layoutDocShelf(List<StructureFile> documents, List<Node> nodes) {
        int rows = (documents.size() + DOC_COLUMNS - 1) / DOC_COLUMNS;
        double width = DOC_COLUMNS * DOC_SPACING + 2.0 * NODE_MARGIN;
        double originX = -(width + CELL_GAP);

        List<String> memberIds = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            StructureFile document = documents.get(i);
            Position position = new Position(
                originX + (i % DOC_COLUMNS) * DOC_SPACING + NODE_MARGIN,
                (double) (i / DOC_COLUMNS) * DOC_SPACING + NODE_MARGIN);
            Node node = fileNode(document, layerClassifier.classify(document.path()), DOC_SHELF_ID, position);
            nodes.add(node);
            memberIds.add(node.id());
        }
        Bounds bounds = new Bounds(originX, 0, width, rows * DOC_SPACING + 2.0 * NODE_MARGIN);
        return new Cluster(DOC_SHELF_ID, "Documentation", null, memberIds, bounds, false);
    }

    private Cluster layoutExternals(TreeSet<String> tokens, double originX, List<Node> nodes) {
        List<String> memberIds = new ArrayList<>();
        int index = 0;
        for (String token : tokens) {
            String path = Dependency.EXTERNAL_PREFIX + token;
            Position position = new Position(
                originX + (index % EXTERNAL_COLUMNS) * NODE_SPACING + NODE_MARGIN,
                (double) (index / EXTERNAL_COLUMNS) * NODE_SPACING + NODE_MARGIN);
            NodeDisplay display = new NodeDisplay(EXTERNAL_LABEL_PREFIX + token, "External module " + token,
                NODE_COLORS.get(NodeKind.EXTERNAL), EXTERNAL_CLUSTER_ID, PROPOSED_OPACITY, PROPOSED_DASH);
            Node node = new Node(nodeId(path), NodeKind.EXTERNAL.value(), NodeStatus.PROPOSED, position,
                EXTERNAL_HINT.layer(), EXTERNAL_HINT.priority(), path, display);
            nodes.add(node);
            memberIds.add(node.id());
            index++;
        }
        int rows = (tokens.size() + EXTERNAL_COLUMNS - 1) / EXTERNAL_COLUMNS;
        Bounds bounds = new Bounds(originX, 0, EXTERNAL_COLUMNS * NODE_SPACING + 2.0 * NODE_MARGIN,
            rows * NODE_SPACING + 2.0 * NODE_MARGIN);
        return new Cluster(EXTERNAL_CLUSTER_ID, "External Modules", null, memberIds, bounds, false);
    }

    // ==================== Nodes and edges ====================

    private Node fileNode(StructureFile file, LayerHint hint, String clusterId, Position position) {
        String path = FileUtils.normalize(file.path());
        NodeDisplay display = new NodeDisplay(FileUtils.fileName(path), file.description(),
            NODE_COLORS.get(file.kind()), clusterId, PROPOSED_OPACITY, PROPOSED_DASH);
        return new Node(nodeId(path), file.kind().value(), NodeStatus.PROPOSED, position,
            hint.layer(), hint.priority(), path, display);
    }

    private List<Edge> buildEdges(List<Dependency> dependencies, List<Node> nodes) {
        Map<String, String> idsByPath = new HashMap<>();
        for (Node node : nodes) {
            idsByPath.put(node.file(), node.id());
        }

        List<Dependency> sorted = new ArrayList<>(dependencies);
        sorted.sort(Comparator.comparing(Dependency::from).thenComparing(Dependency::to)
            .thenComparing(dependency -> dependency.kind().value()));

        List<Edge> edges = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Dependency dependency : sorted) {
            String fromId = idsByPath.get(FileUtils.normalize(dependency.from()));
            String toId = idsByPath.get(FileUtils.normalize(dependency.to()));
            if (fromId == null || toId == null) {
                log.debug("Skipping dependency with unknown endpoint: {} -> {}", dependency.from(), dependency.to());
                continue;
            }
            if (fromId.equals(toId)) {
                continue;
            }
            String edgeId = EDGE_ID_PREFIX + IdGenerator.generate(fromId, toId, dependency.kind().value());
            if (seen.add(edgeId)) {
                edges.add(new Edge(edgeId, fromId, toId, dependency.kind(), false, EDGE_STYLES.get(dependency.kind())));
            }
        }
        return edges;
    }

    /**
     * Returns the node id of a project path or external path.
     *
     * @param path project-relative path, or {@code external:<token>}
     * @return stable node id
     */
    public static String nodeId(String path) {
        return NODE_ID_PREFIX + IdGenerator.generate(path);
    }

    // ==================== Helpers ====================

    private static int depthOf(String directory) {
        return ".".equals(directory) ? 0 : directory.split("/").length;
    }

    private static double sum(double[] values, int count) {
        double total = 0;
        for (int i = 0; i < count; i++) {
            total += values[i];
        }
        return total;
    }

    private static Bounds union(Bounds a, Bounds b) {
        double minX = Math.min(a.x(), b.x());
        double minY = Math.min(a.y(), b.y());
        double maxX = Math.max(a.x() + a.width(), b.x() + b.width());
        double maxY = Math.max(a.y() + a.height(), b.y() + b.height());
        return new Bounds(minX, minY, maxX - minX, maxY - minY);
    }

    private record PlacedFile(StructureFile file, LayerHint hint, double x, double y) {}

    private record GroupLayout(List<PlacedFile> files, double width, double height) {}

    /**
     * Allocates unique cluster ids from sanitized directory paths.
     */
    private static final class ClusterIds {

        private final Map<String, String> byDirectory = new HashMap<>();
        private final Set<String> used = new HashSet<>();

        String forDirectory(String directory) {
            return byDirectory.computeIfAbsent(directory, this::allocate);
        }

        private String allocate(String directory) {
            String base = CLUSTER_ID_PREFIX + (".".equals(directory)
                ? ROOT_CLUSTER_LABEL
                : directory.replaceAll("[^A-Za-z0-9_]", "_"));
            String id = used.contains(base) ? base + "_" + IdGenerator.generate(directory).substring(0, 6) : base;
            used.add(id);
            return id;
        }
    }
}

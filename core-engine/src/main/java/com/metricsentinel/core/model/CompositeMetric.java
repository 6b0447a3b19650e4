package com.metricsentinel.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Branch metric holding an ordered collection of uniquely named children,
 * each either a {@link Metric} or another {@code CompositeMetric}.
 *
 * <p>
 * Children are addressed with relative key paths of the form
 * {@code child/grandchild#leaf}. For a root named {@code Performance}:
 * </p>
 *
 * <pre>
 * CompositeMetric performance = new CompositeMetric("Performance");
 * CompositeMetric overall = performance.add(new CompositeMetric("overall_usage"));
 * overall.addKeyValue("user_cpu", 89.0);
 *
 * performance.element("overall_usage#user_cpu");   // the user_cpu Metric
 * performance.flatten();                           // {/Performance/overall_usage#user_cpu=89.0}
 * </pre>
 *
 * <h3>Ownership</h3>
 * <p>
 * A composite owns its subtree exclusively. A composite can be attached to
 * one parent at a time; {@link #remove(String)} detaches it again. Adding a
 * composite that already contains this one (directly or further down) is
 * rejected, so the tree can never become cyclic. Leaves are immutable and
 * may be shared.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Callers sharing an
 * instance across threads must serialize access themselves.
 * </p>
 *
 * @since 1.0.0
 */
public class CompositeMetric extends BasicMetric {

    private final Map<String, BasicMetric> children = new LinkedHashMap<>();
    private CompositeMetric parent;

    /**
     * Create an empty composite.
     *
     * @param name composite name; non-empty and free of {@code '#'} and {@code '/'}
     * @throws NullPointerException     if {@code name} is {@code null}
     * @throws IllegalArgumentException if the name is invalid
     */
    public CompositeMetric(String name) {
        super(name);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Metric name cannot be empty");
        }
        if (name.indexOf(LEAF_SEPARATOR) >= 0 || name.indexOf(PATH_SEPARATOR) >= 0) {
            throw new IllegalArgumentException(
                    "Composite metric names cannot contain '#' or '/': " + name);
        }
    }

    /**
     * Create a composite populated with the given children.
     *
     * @param name     composite name
     * @param children initial children; names must be unique
     * @throws IllegalArgumentException if two children share a name
     */
    public CompositeMetric(String name, Collection<? extends BasicMetric> children) {
        this(name);
        Objects.requireNonNull(children, "Children must not be null");
        for (BasicMetric child : children) {
            add(child);
        }
    }

    // ---------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------

    /**
     * Add a child metric.
     *
     * @param child the metric to add; must not be {@code null}
     * @param <T>   the child's type
     * @return {@code child}, for chaining
     * @throws IllegalArgumentException if a child of the same name already
     *                                  exists, the child is a composite that
     *                                  already has a parent, or the addition
     *                                  would create a cycle
     */
    public <T extends BasicMetric> T add(T child) {
        Objects.requireNonNull(child, "Child metric must not be null");
        if (children.containsKey(child.getName())) {
            throw new IllegalArgumentException("Composite metric '" + getName()
                    + "' already contains a child named '" + child.getName() + "'");
        }
        if (child instanceof CompositeMetric composite) {
            if (composite.parent != null) {
                throw new IllegalArgumentException("Composite metric '" + child.getName()
                        + "' is already a child of '" + composite.parent.getName() + "'");
            }
            if (composite.containsNode(this)) {
                throw new IllegalArgumentException("Adding '" + child.getName() + "' to '"
                        + getName() + "' would create a cycle");
            }
            composite.parent = this;
        }
        children.put(child.getName(), child);
        return child;
    }

    /**
     * Wrap a value in a {@link Metric} and add it.
     *
     * @param name  leaf name
     * @param value leaf value
     * @return the created metric
     */
    public Metric addKeyValue(String name, Number value) {
        return add(new Metric(name, value));
    }

    /**
     * Remove the direct child with the given name. A removed composite is
     * detached and may be added elsewhere.
     *
     * @param name child name
     * @return the removed child
     * @throws MetricLookupException if no such child exists
     */
    public BasicMetric remove(String name) {
        BasicMetric removed = children.remove(name);
        if (removed == null) {
            throw new MetricLookupException(name + " not found in composite metric " + getName());
        }
        if (removed instanceof CompositeMetric composite) {
            composite.parent = null;
        }
        return removed;
    }

    // ---------------------------------------------------------------
    // Navigation
    // ---------------------------------------------------------------

    /**
     * @return unmodifiable, insertion-ordered view of the direct children
     */
    public Collection<BasicMetric> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    /**
     * @param name direct child name
     * @return the child, or empty if there is none by that name
     */
    public Optional<BasicMetric> child(String name) {
        return Optional.ofNullable(children.get(name));
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * Resolve a key path relative to this composite.
     *
     * <p>
     * Accepted forms:
     * </p>
     * <ul>
     * <li>{@code name} : a direct child</li>
     * <li>{@code #leaf} : a leaf directly under this composite</li>
     * <li>{@code a/b#leaf} : a leaf under nested composites</li>
     * <li>{@code a/b} : a nested composite</li>
     * </ul>
     *
     * @param keyPath relative path; must not start with {@code '/'}
     * @return the addressed metric
     * @throws MetricLookupException if the path is malformed or does not
     *                               resolve
     */
    public BasicMetric element(String keyPath) {
        Objects.requireNonNull(keyPath, "Key path must not be null");
        if (keyPath.startsWith(String.valueOf(PATH_SEPARATOR))) {
            throw new MetricLookupException("Key path must be relative and not start with '/': " + keyPath);
        }

        String path;
        String leafName = null;
        int marker = keyPath.indexOf(LEAF_SEPARATOR);
        if (marker >= 0) {
            if (keyPath.indexOf(LEAF_SEPARATOR, marker + 1) >= 0) {
                throw new MetricLookupException("Key path must contain at most one '#': " + keyPath);
            }
            path = keyPath.substring(0, marker);
            leafName = keyPath.substring(marker + 1);
            if (leafName.isEmpty()) {
                throw new MetricLookupException("Key path has an empty leaf name: " + keyPath);
            }
        } else if (keyPath.indexOf(PATH_SEPARATOR) < 0) {
            BasicMetric child = children.get(keyPath);
            if (child == null) {
                throw notFound(keyPath);
            }
            return child;
        } else {
            path = keyPath;
        }

        CompositeMetric current = this;
        if (!path.isEmpty()) {
            for (String segment : path.split(String.valueOf(PATH_SEPARATOR), -1)) {
                BasicMetric next = current.children.get(segment);
                if (!(next instanceof CompositeMetric composite)) {
                    throw notFound(keyPath);
                }
                current = composite;
            }
        }
        if (leafName == null) {
            return current;
        }
        BasicMetric leaf = current.children.get(leafName);
        if (leaf == null) {
            throw notFound(keyPath);
        }
        return leaf;
    }

    /**
     * Resolve a key path that must address a leaf.
     *
     * @param keyPath relative path, see {@link #element(String)}
     * @return the addressed leaf
     * @throws MetricLookupException if the path does not resolve to a
     *                               {@link Metric}
     */
    public Metric metric(String keyPath) {
        BasicMetric found = element(keyPath);
        if (!(found instanceof Metric metric)) {
            throw new MetricLookupException(keyPath + " is a composite metric, not a leaf");
        }
        return metric;
    }

    /**
     * Equivalent to {@code keys(false)}.
     *
     * @return every descendant path
     */
    public Set<String> keys() {
        return keys(false);
    }

    /**
     * Collect descendant key paths relative to this composite.
     *
     * <p>
     * Leaf paths always carry a {@code '#'} before the leaf name, including
     * leaves directly under this composite ({@code #cpu}).
     * </p>
     *
     * @param coreOnly {@code true} to return leaf paths only, {@code false}
     *                 to include the path of every nested composite as well
     * @return insertion-ordered set of key paths
     */
    public Set<String> keys(boolean coreOnly) {
        Set<String> result = new LinkedHashSet<>();
        collectKeys(coreOnly, "", result);
        return result;
    }

    private void collectKeys(boolean coreOnly, String root, Set<String> result) {
        for (BasicMetric child : children.values()) {
            if (child instanceof Metric) {
                result.add(root + LEAF_SEPARATOR + child.getName());
            } else {
                CompositeMetric composite = (CompositeMetric) child;
                String nested = root.isEmpty()
                        ? child.getName()
                        : root + PATH_SEPARATOR + child.getName();
                if (!coreOnly) {
                    result.add(nested);
                }
                composite.collectKeys(coreOnly, nested, result);
            }
        }
    }

    @Override
    public Map<String, Number> flatten(String prefix) {
        String path = (prefix == null ? "" : prefix) + PATH_SEPARATOR + getName();
        Map<String, Number> result = new LinkedHashMap<>();
        for (BasicMetric child : children.values()) {
            result.putAll(child.flatten(path));
        }
        return result;
    }

    private boolean containsNode(BasicMetric node) {
        if (this == node) {
            return true;
        }
        for (BasicMetric child : children.values()) {
            if (child instanceof CompositeMetric composite && composite.containsNode(node)) {
                return true;
            }
        }
        return false;
    }

    private MetricLookupException notFound(String keyPath) {
        return new MetricLookupException(keyPath + " not found in composite metric " + getName());
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CompositeMetric that))
            return false;
        return getName().equals(that.getName()) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), children);
    }

    @Override
    public String toString() {
        return "CompositeMetric{name='" + getName() + "', children=" + children.values() + '}';
    }
}

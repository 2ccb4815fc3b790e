package edu.brandeis.cosi103a.rankings.rating;

import io.github.classgraph.ClassGraph;
import io.github.classgraph.ClassInfo;
import io.github.classgraph.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds {@link ExpectedScoreBackend} implementations on the classpath and caches their metadata.
 * Only concrete classes with a public zero-argument constructor are listed.
 */
public class ExpectedScoreBackendDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ExpectedScoreBackendDiscovery.class);

    private final String[] packages;
    private final Map<String, DiscoveredBackend> backendsByClassName = new ConcurrentHashMap<>();
    private volatile List<DiscoveredBackend> cachedBackends = List.of();

    /**
     * @param packages packages to scan; none means the whole classpath
     */
    public ExpectedScoreBackendDiscovery(String... packages) {
        this.packages = packages.clone();
    }

    public synchronized void scanClasspath() {
        List<RawBackendInfo> raw = new ArrayList<>();

        ClassGraph graph = new ClassGraph().enableClassInfo().enableAnnotationInfo();
        if (packages.length > 0) {
            graph.acceptPackages(packages);
        }
        try (ScanResult result = graph.scan()) {
            for (ClassInfo classInfo : result.getClassesImplementing(ExpectedScoreBackend.class.getName())) {
                if (classInfo.isInterface() || classInfo.isAbstract()) {
                    continue;
                }
                String className = classInfo.getName();
                try {
                    Class<?> backendClass = Class.forName(className);
                    if (hasPublicZeroArgConstructor(backendClass)) {
                        raw.add(analyze(backendClass));
                    }
                } catch (ReflectiveOperationException | LinkageError e) {
                    log.warn("Could not analyze backend class {}: {}", className, e.getMessage());
                }
            }
        }

        Map<String, Integer> simpleNameCounts = new HashMap<>();
        for (RawBackendInfo info : raw) {
            simpleNameCounts.merge(info.simpleName(), 1, Integer::sum);
        }

        backendsByClassName.clear();
        for (RawBackendInfo info : raw) {
            boolean duplicate = simpleNameCounts.get(info.simpleName()) > 1;
            String displayName = duplicate ? info.className() : info.simpleName();
            backendsByClassName.put(info.className(),
                new DiscoveredBackend(info.simpleName(), info.className(), displayName, info.description()));
        }

        List<DiscoveredBackend> all = new ArrayList<>(backendsByClassName.values());
        all.sort(Comparator.comparing(DiscoveredBackend::displayName));
        cachedBackends = List.copyOf(all);
        log.debug("Discovered {} expected-score backends", cachedBackends.size());
    }

    private record RawBackendInfo(String simpleName, String className, String description) {}

    private static RawBackendInfo analyze(Class<?> backendClass) {
        BackendDescription annotation = backendClass.getAnnotation(BackendDescription.class);
        String description = annotation != null ? annotation.value() : "";
        return new RawBackendInfo(backendClass.getSimpleName(), backendClass.getName(), description);
    }

    private static boolean hasPublicZeroArgConstructor(Class<?> type) {
        if (!Modifier.isPublic(type.getModifiers())) {
            return false;
        }
        for (Constructor<?> ctor : type.getConstructors()) {
            if (ctor.getParameterCount() == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Discovered backends sorted by display name.
     */
    public List<DiscoveredBackend> getDiscoveredBackends() {
        return cachedBackends;
    }

    public Optional<DiscoveredBackend> findByClassName(String className) {
        return Optional.ofNullable(backendsByClassName.get(className));
    }

    /**
     * Instantiates a discovered backend through its zero-argument constructor.
     *
     * @throws ReflectiveOperationException if instantiation fails
     */
    public ExpectedScoreBackend createBackend(DiscoveredBackend discovered) throws ReflectiveOperationException {
        Class<?> backendClass = Class.forName(discovered.className());
        Constructor<?> ctor = backendClass.getConstructor();
        return (ExpectedScoreBackend) ctor.newInstance();
    }

    public synchronized void clear() {
        backendsByClassName.clear();
        cachedBackends = List.of();
    }
}

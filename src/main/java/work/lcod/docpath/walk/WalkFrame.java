package work.lcod.docpath.walk;

import work.lcod.docpath.path.Path;

/**
 * Recursion frame of a walk: the container holding the current node, the key or index of the
 * node inside it and the concrete path walked so far.
 */
record WalkFrame(Object parent, String key, Path walkedPath, boolean appendOnMutate) {
    static WalkFrame root() {
        return new WalkFrame(null, "", Path.empty(), false);
    }

    WalkFrame push(String childKey, Object container) {
        return new WalkFrame(container, childKey, walkedPath.append(childKey), false);
    }

    WalkFrame pushAppend(String childKey, Object container) {
        return new WalkFrame(container, childKey, walkedPath.append(childKey), true);
    }
}

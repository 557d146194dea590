// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.site;

/**
 * What the site generator does when a contract fails to render.
 */
public enum FailurePolicy {
    /**
     * Stop generating at the first failure.
     */
    ABORT,
    /**
     * Leave out the page of the entity whose contract failed, and carry on with the rest.
     */
    SKIP
}

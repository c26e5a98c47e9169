package com.aramcoach.core.facts;

import com.aramcoach.core.model.FactSet;

/**
 * Loads the static facts for a patch.
 */
public interface FactLoader {

    /**
     * @throws PatchNotFoundException if the patch id is unknown
     * @throws DataCorruptException   if stored records fail validation
     */
    FactSet load(String patchId);
}

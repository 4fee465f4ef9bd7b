package com.credwallet.backend.modules.share.application;

import com.credwallet.backend.modules.share.domain.Share;

/**
 * A share together with its effectiveness at the moment the listing was taken.
 */
public record ShareEntry(Share share, boolean effective) {
}

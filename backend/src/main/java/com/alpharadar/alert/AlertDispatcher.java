package com.alpharadar.alert;

import com.alpharadar.trending.TrendingToken;

/**
 * Delivers one trending alert. Returning normally means the alert was delivered (or deliberately logged in
 * dry-run mode) and the token may be put on cooldown. Any runtime exception counts as not delivered and no
 * cooldown is recorded.
 */
public interface AlertDispatcher {

    void dispatch(TrendingToken token);
}

package com.luanvv.listings.crawl;

import com.luanvv.listings.core.BrowserSession;
import com.luanvv.listings.core.Config;

@FunctionalInterface
public interface SessionFactory {

    /** Opens a started session; the caller closes it. */
    BrowserSession open(String name);

    static SessionFactory playwright(Config config) {
        return name -> {
            BrowserSession session = new BrowserSession(config, name);
            try {
                session.start();
            } catch (RuntimeException e) {
                session.close();
                throw e;
            }
            return session;
        };
    }
}

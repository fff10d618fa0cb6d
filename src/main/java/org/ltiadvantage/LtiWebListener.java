package org.ltiadvantage;

import java.io.IOException;
import java.time.Clock;
import java.util.logging.Logger;

import jakarta.servlet.ServletContext;
import jakarta.servlet.ServletContextEvent;
import jakarta.servlet.ServletContextListener;
import jakarta.servlet.annotation.WebListener;

import com.google.cloud.datastore.Datastore;
import com.google.cloud.datastore.DatastoreOptions;
import com.googlecode.objectify.ObjectifyFactory;
import com.googlecode.objectify.ObjectifyService;

/* Builds the tool's shared objects when the web application starts and publishes them
 * as ServletContext attributes for the filters and servlets:
 *  - the Datastores chosen by lti.datastore (memory, jdbc or objectify)
 *  - the LaunchValidator used by LaunchFilter
 *  - the tool's signing key, if one is configured
 */
@WebListener
public class LtiWebListener implements ServletContextListener {

	private static final Logger logger = Logger.getLogger(LtiWebListener.class.getName());

	public static final String STORES_ATTRIBUTE = "org.ltiadvantage.stores";
	public static final String VALIDATOR_ATTRIBUTE = "org.ltiadvantage.validator";
	public static final String TOOL_KEY_ATTRIBUTE = "org.ltiadvantage.toolKey";

	@Override
	public void contextInitialized(ServletContextEvent event) {
		LtiSettings settings;
		try {
			settings = LtiSettings.load();
		} catch (IOException e) {
			throw new IllegalStateException("Unable to read " + LtiSettings.RESOURCE, e);
		}
		initialize(event.getServletContext(), settings);
	}

	void initialize(ServletContext context, LtiSettings settings) {
		Datastores stores = createStores(settings);
		context.setAttribute(STORES_ATTRIBUTE, stores);
		context.setAttribute(VALIDATOR_ATTRIBUTE, new LaunchValidator(stores, settings.httpTimeout()));

		ToolKey key = loadToolKey(settings);
		if (key == null) logger.warning("No signing key is configured (" + LtiSettings.KEY_ID + ", " + LtiSettings.KEY_PEM + "); AGS and NRPS calls will fail.");
		else context.setAttribute(TOOL_KEY_ATTRIBUTE, key);
	}

	static Datastores createStores(LtiSettings settings) {
		String kind = settings.datastore();
		switch (kind) {
		case "memory":
			logger.info("Using the in-memory LTI store.");
			return Datastores.of(new InMemoryStore(Clock.systemUTC(), settings.nonceLifetime(), settings.launchLifetime()));
		case "jdbc":
			JdbcStore jdbc = new JdbcStore(settings.get(LtiSettings.JDBC_URL), settings.get(LtiSettings.JDBC_USER), settings.get(LtiSettings.JDBC_PASSWORD),
					Clock.systemUTC(), settings.nonceLifetime(), settings.launchLifetime());
			try {
				jdbc.createSchema();
			} catch (DatastoreException e) {
				throw new IllegalStateException(e.getMessage(), e);
			}
			logger.info("Using the JDBC LTI store.");
			return Datastores.of(jdbc);
		case "objectify":
			// Use DatastoreOptions.newBuilder().setDatabaseId(...) to connect to a non-default database
			final Datastore datastore = DatastoreOptions.newBuilder().build().getService();
			ObjectifyService.init(new ObjectifyFactory(datastore));
			ObjectifyStore.register();
			logger.info("Using the Cloud Datastore LTI store.");
			return Datastores.of(new ObjectifyStore(Clock.systemUTC(), settings.nonceLifetime(), settings.launchLifetime()));
		default:
			throw new IllegalStateException("Unknown " + LtiSettings.DATASTORE + " value: " + kind);
		}
	}

	static ToolKey loadToolKey(LtiSettings settings) {
		String pem = settings.get(LtiSettings.KEY_PEM);
		if (pem == null) return null;
		try {
			return ToolKey.fromPem(settings.get(LtiSettings.KEY_ID), pem);
		} catch (SigningKeyException e) {
			throw new IllegalStateException(e.getMessage(), e);
		}
	}

	@Override
	public void contextDestroyed(ServletContextEvent event) {
	}
}
